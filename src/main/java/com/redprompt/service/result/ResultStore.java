package com.redprompt.service.result;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONException;
import com.alibaba.fastjson2.JSONObject;
import com.alibaba.fastjson2.JSONWriter;
import com.redprompt.config.AppConfig;
import com.redprompt.model.TestRunResult;
import com.redprompt.util.AppLog;
import org.apache.commons.io.FileUtils;

import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * 运行记录的文件存储：每次运行一个 {resultsDir}/{runId}.json。
 */
public class ResultStore {
    private static final Pattern RUN_ID = Pattern.compile("[A-Za-z0-9_-]+");

    private final File directory;

    public ResultStore(File directory) {
        this.directory = directory;
    }

    public static ResultStore fromConfig(AppConfig cfg) {
        return new ResultStore(new File(cfg.getResultsDir()));
    }

    public File getDirectory() {
        return directory;
    }

    public File save(TestRunResult run) {
        if (run == null) throw new IllegalArgumentException("run is null");
        File out = fileFor(run.getTestRunId());
        String json = JSON.toJSONString(run.toJson(), JSONWriter.Feature.PrettyFormat, JSONWriter.Feature.WriteNulls);
        try {
            FileUtils.writeStringToFile(out, json, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write result file " + out, e);
        }
        AppLog.info("[store] saved run " + run.getTestRunId() + " -> " + out.getPath());
        return out;
    }

    /**
     * 返回所有运行记录，按 timestamp 倒序（最新在前）。损坏的文件跳过并记录告警。
     */
    public List<JSONObject> list() {
        List<JSONObject> runs = new ArrayList<>();
        File[] files = directory.listFiles((dir, name) -> name.endsWith(".json"));
        if (files == null) return runs;
        for (File f : files) {
            JSONObject obj = read(f);
            if (obj != null) runs.add(obj);
        }
        runs.sort((a, b) -> safe(b.getString("timestamp")).compareTo(safe(a.getString("timestamp"))));
        return runs;
    }

    /**
     * @return 运行记录，不存在时返回 null
     */
    public JSONObject get(String runId) {
        if (runId == null || !RUN_ID.matcher(runId).matches()) return null;
        File f = fileFor(runId);
        if (!f.isFile()) return null;
        return read(f);
    }

    private File fileFor(String runId) {
        if (runId == null || !RUN_ID.matcher(runId).matches()) {
            throw new IllegalArgumentException("invalid run id: " + runId);
        }
        return new File(directory, runId + ".json");
    }

    private static JSONObject read(File f) {
        try {
            return JSON.parseObject(FileUtils.readFileToString(f, StandardCharsets.UTF_8));
        } catch (IOException | JSONException e) {
            AppLog.warn("[store] skipping unreadable result file " + f.getName() + ": " + e.getMessage());
            return null;
        }
    }

    private static String safe(String s) {
        return s == null ? "" : s;
    }
}
