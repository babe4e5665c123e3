package com.redprompt.service.prompt;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONException;
import com.alibaba.fastjson2.JSONObject;
import com.redprompt.model.Prompt;
import com.redprompt.util.AppLog;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.apache.commons.io.FileUtils;
import org.apache.commons.io.FilenameUtils;

import java.io.File;
import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * 解析上传的 prompt 文件（JSON / CSV），每条 prompt 通过 {@link Prompt#create} 生成并自动打上 prompt 侧安全标签。
 *
 * <p>JSON 支持：字符串数组、对象数组（prompt 或 text 字段，tags 为数组或逗号分隔字符串）、
 * 带 prompts 数组的对象、单个对象。</p>
 * <p>CSV 需要表头：prompt 列名为 prompt/prompts/text/message/query 之一，可选 tags 列名为
 * tags/tag/categories/category/labels/label 之一，表头不区分大小写。</p>
 */
public final class PromptFileParser {
    static final List<String> PROMPT_COLUMNS = Arrays.asList("prompt", "prompts", "text", "message", "query");
    static final List<String> TAG_COLUMNS = Arrays.asList("tags", "tag", "categories", "category", "labels", "label");

    private PromptFileParser() {
    }

    public static List<Prompt> parse(File file) {
        if (file == null || !file.isFile()) {
            throw new PromptFileException("Prompt file not found: " + file);
        }
        String ext = FilenameUtils.getExtension(file.getName()).toLowerCase(Locale.ROOT);
        if (!"json".equals(ext) && !"csv".equals(ext)) {
            throw new PromptFileException("Unsupported file format. Only JSON and CSV are supported.");
        }
        String content;
        try {
            content = FileUtils.readFileToString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new PromptFileException("Failed to read prompt file: " + file, e);
        }
        List<Prompt> prompts = "json".equals(ext) ? parseJson(content) : parseCsv(content);
        AppLog.info("[prompts] parsed " + prompts.size() + " prompts from " + file.getName());
        return prompts;
    }

    public static List<Prompt> parseJson(String content) {
        Object data;
        try {
            data = JSON.parse(stripBom(content));
        } catch (JSONException e) {
            throw new PromptFileException("Invalid JSON prompt file: " + e.getMessage(), e);
        }
        List<Prompt> prompts = new ArrayList<>();
        if (data instanceof JSONArray) {
            addItems((JSONArray) data, prompts);
        } else if (data instanceof JSONObject) {
            JSONObject obj = (JSONObject) data;
            if (obj.containsKey("prompts")) {
                JSONArray items = obj.getJSONArray("prompts");
                if (items != null) addItems(items, prompts);
            } else {
                addItem(obj, prompts);
            }
        } else if (data != null) {
            throw new PromptFileException("Unsupported JSON structure: " + data.getClass().getSimpleName());
        }
        return prompts;
    }

    private static void addItems(JSONArray items, List<Prompt> out) {
        for (Object item : items) {
            if (item instanceof String) {
                String text = ((String) item).trim();
                if (!text.isEmpty()) out.add(Prompt.create(text, Collections.<String>emptyList()));
            } else if (item instanceof JSONObject) {
                addItem((JSONObject) item, out);
            }
        }
    }

    private static void addItem(JSONObject item, List<Prompt> out) {
        String text = item.getString("prompt");
        if (text == null || text.trim().isEmpty()) {
            text = item.getString("text");
        }
        if (text == null || text.trim().isEmpty()) return;
        out.add(Prompt.create(text.trim(), readTags(item.get("tags"))));
    }

    private static List<String> readTags(Object raw) {
        if (raw instanceof String) {
            return splitTags((String) raw);
        }
        List<String> tags = new ArrayList<>();
        if (raw instanceof JSONArray) {
            for (Object t : (JSONArray) raw) {
                if (t == null) continue;
                String s = t.toString().trim();
                if (!s.isEmpty()) tags.add(s);
            }
        }
        return tags;
    }

    public static List<Prompt> parseCsv(String content) {
        CSVFormat format = CSVFormat.DEFAULT.builder()
                .setHeader()
                .setSkipHeaderRecord(true)
                .setIgnoreEmptyLines(true)
                .setAllowMissingColumnNames(true)
                .setTrim(true)
                .build();
        List<Prompt> prompts = new ArrayList<>();
        try (CSVParser parser = format.parse(new StringReader(stripBom(content)))) {
            String promptColumn = findColumn(parser.getHeaderNames(), PROMPT_COLUMNS);
            if (promptColumn == null) {
                throw new PromptFileException("No prompt column found. Expected column names: 'prompt', 'text', 'message', or 'query'");
            }
            String tagsColumn = findColumn(parser.getHeaderNames(), TAG_COLUMNS);
            for (CSVRecord record : parser) {
                if (!record.isSet(promptColumn)) continue;
                String text = record.get(promptColumn).trim();
                if (text.isEmpty() || "nan".equalsIgnoreCase(text)) continue;
                List<String> tags = new ArrayList<>();
                if (tagsColumn != null && record.isSet(tagsColumn)) {
                    tags = splitTags(record.get(tagsColumn));
                }
                prompts.add(Prompt.create(text, tags));
            }
        } catch (IOException | IllegalArgumentException | IllegalStateException e) {
            throw new PromptFileException("Invalid CSV prompt file: " + e.getMessage(), e);
        }
        return prompts;
    }

    private static String findColumn(List<String> headers, List<String> accepted) {
        for (String h : headers) {
            if (h != null && accepted.contains(h.trim().toLowerCase(Locale.ROOT))) {
                return h;
            }
        }
        return null;
    }

    static List<String> splitTags(String raw) {
        List<String> tags = new ArrayList<>();
        if (raw == null) return tags;
        for (String part : raw.split(",")) {
            String t = part.trim();
            if (!t.isEmpty()) tags.add(t);
        }
        return tags;
    }

    private static String stripBom(String content) {
        if (content == null) return "";
        return content.startsWith("\uFEFF") ? content.substring(1) : content;
    }
}
