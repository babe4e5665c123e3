package com.redprompt.agent;

import com.alibaba.fastjson2.JSONObject;
import com.alibaba.fastjson2.JSONWriter;
import com.redprompt.config.AppConfig;
import com.redprompt.model.Prompt;
import com.redprompt.model.RunConfig;
import com.redprompt.model.TestRunResult;
import com.redprompt.service.prompt.PromptFileException;
import com.redprompt.service.prompt.PromptFileParser;
import com.redprompt.service.run.RunTicket;
import com.redprompt.service.run.TestRunService;

import java.io.File;
import java.io.InputStream;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Scanner;
import java.util.concurrent.ExecutionException;

/**
 * 命令行控制台。
 * 加载 prompt 文件、对目标页面发起后台运行、查看历史结果。
 *
 * <p>当前加载的 prompt 列表属于本控制台会话，提交运行时显式传给 {@link TestRunService}。</p>
 */
public class ConsoleAgent {
    private final TestRunService service;
    private final PrintStream out;
    private List<Prompt> currentPrompts = new ArrayList<>();
    private RunTicket lastRun;

    public ConsoleAgent(TestRunService service, PrintStream out) {
        this.service = service;
        this.out = out;
    }

    public static void main(String[] args) {
        AppConfig cfg = AppConfig.getInstance();
        try (TestRunService service = TestRunService.fromConfig(cfg)) {
            new ConsoleAgent(service, System.out).loop(System.in);
        }
    }

    public void loop(InputStream in) {
        Scanner scanner = new Scanner(in);
        out.println("==========================================");
        out.println("RedPrompt 聊天组件安全探测控制台");
        out.println("输入 'help' 查看可用命令");
        out.println("==========================================");

        while (true) {
            out.print("RedPrompt> ");
            if (!scanner.hasNextLine()) break;
            String line = scanner.nextLine().trim();
            if (line.isEmpty()) continue;
            if (!handle(line)) return;
        }
    }

    /**
     * 执行一条命令。
     *
     * @return false 表示退出
     */
    public boolean handle(String line) {
        String[] parts = line.trim().split("\\s+");
        String command = parts[0].toLowerCase();
        try {
            switch (command) {
                case "exit":
                case "quit":
                    out.println("再见！");
                    return false;
                case "help":
                    printHelp();
                    break;
                case "load":
                    load(parts);
                    break;
                case "prompts":
                    listPrompts();
                    break;
                case "clear":
                    currentPrompts = new ArrayList<>();
                    out.println("Prompts cleared successfully");
                    break;
                case "run":
                    run(parts);
                    break;
                case "wait":
                    waitForLastRun();
                    break;
                case "results":
                    listResults();
                    break;
                case "result":
                    showResult(parts);
                    break;
                default:
                    out.println("未知命令: " + command + "，输入 'help' 查看可用命令");
            }
        } catch (PromptFileException | IllegalArgumentException e) {
            out.println("错误: " + e.getMessage());
        }
        return true;
    }

    public List<Prompt> getCurrentPrompts() {
        return Collections.unmodifiableList(currentPrompts);
    }

    private void printHelp() {
        out.println("可用命令:");
        out.println("  load <file.json|file.csv>          加载对抗性 prompt 文件（替换当前列表）");
        out.println("  prompts                            查看当前加载的 prompt");
        out.println("  clear                              清空当前 prompt 列表");
        out.println("  run <url> [maxTimeout] [delay]     在后台对目标页面执行当前 prompt 列表");
        out.println("  wait                               等待最近一次运行结束并输出汇总");
        out.println("  results                            列出所有历史运行");
        out.println("  result <runId>                     查看指定运行的完整结果");
        out.println("  exit / quit                        退出程序");
    }

    private void load(String[] parts) {
        if (parts.length < 2) {
            out.println("用法: load <file.json|file.csv>");
            return;
        }
        currentPrompts = new ArrayList<>(PromptFileParser.parse(new File(parts[1])));
        out.println("Successfully uploaded " + currentPrompts.size() + " prompts");
    }

    private void listPrompts() {
        out.println("当前 prompt 数量: " + currentPrompts.size());
        for (Prompt p : currentPrompts) {
            out.println("- " + p.getId() + " " + p.getTags() + " : " + p.getText());
        }
    }

    private void run(String[] parts) {
        if (parts.length < 2) {
            out.println("用法: run <url> [maxTimeout] [delay]");
            return;
        }
        RunConfig config = RunConfig.defaults();
        if (parts.length > 2) {
            config = config.withMaxTimeoutSeconds(parseInt(parts[2], "maxTimeout"));
        }
        if (parts.length > 3) {
            config = config.withDelayBetweenPromptsSeconds(parseInt(parts[3], "delay"));
        }
        lastRun = service.submit(parts[1], currentPrompts, config);
        out.println("Test execution started for " + lastRun.getPromptCount() + " prompts, run id: " + lastRun.getRunId());
    }

    private void waitForLastRun() {
        if (lastRun == null) {
            out.println("没有进行中的运行");
            return;
        }
        try {
            TestRunResult run = lastRun.getFuture().get();
            out.println("运行 " + run.getTestRunId() + " 结束: status=" + run.getStatus()
                    + ", total=" + run.getTotalPrompts()
                    + ", successful=" + run.getSuccessfulTests()
                    + ", failed=" + run.getFailedTests()
                    + (run.getError() == null ? "" : ", error=" + run.getError()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            out.println("等待被中断");
        } catch (ExecutionException e) {
            out.println("运行异常: " + e.getCause());
        }
    }

    private void listResults() {
        List<JSONObject> runs = service.getStore().list();
        out.println("历史运行数量: " + runs.size());
        for (JSONObject run : runs) {
            out.printf("- %s  %s  %s  %s/%s%n",
                    run.getString("test_run_id"),
                    run.getString("timestamp"),
                    run.getString("status"),
                    run.getIntValue("successful_tests"),
                    run.getIntValue("total_prompts"));
        }
    }

    private void showResult(String[] parts) {
        if (parts.length < 2) {
            out.println("用法: result <runId>");
            return;
        }
        JSONObject run = service.getStore().get(parts[1]);
        if (run == null) {
            out.println("Test run not found");
            return;
        }
        out.println(run.toJSONString(JSONWriter.Feature.PrettyFormat));
    }

    private static int parseInt(String raw, String name) {
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " must be an integer: " + raw);
        }
    }
}
