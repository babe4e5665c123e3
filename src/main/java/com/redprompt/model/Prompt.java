package com.redprompt.model;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;
import com.redprompt.service.security.SecurityTagAnalyzer;

import java.util.Collection;
import java.util.Collections;
import java.util.Set;
import java.util.UUID;

/**
 * 一条待测的对抗性 prompt。创建后不可变。
 *
 * <p>tags 在创建时一次性计算：调用方提供的标签 ∪ {@link SecurityTagAnalyzer#promptTags(String)}。</p>
 */
public final class Prompt {
    private final String id;
    private final String text;
    private final Set<String> tags;

    private Prompt(String id, String text, Set<String> tags) {
        this.id = id;
        this.text = text;
        this.tags = tags;
    }

    public static Prompt create(String text, Collection<String> callerTags) {
        return create(UUID.randomUUID().toString(), text, callerTags);
    }

    public static Prompt create(String id, String text, Collection<String> callerTags) {
        if (id == null || id.trim().isEmpty()) {
            throw new IllegalArgumentException("prompt id is empty");
        }
        if (text == null || text.trim().isEmpty()) {
            throw new IllegalArgumentException("prompt text is empty");
        }
        Set<String> tags = SecurityTagAnalyzer.merge(callerTags, SecurityTagAnalyzer.promptTags(text));
        return new Prompt(id, text, tags);
    }

    public String getId() {
        return id;
    }

    public String getText() {
        return text;
    }

    public Set<String> getTags() {
        return Collections.unmodifiableSet(tags);
    }

    public JSONObject toJson() {
        JSONObject obj = new JSONObject();
        obj.put("id", id);
        obj.put("prompt", text);
        obj.put("status", PromptStatus.PENDING.value());
        obj.put("tags", new JSONArray(tags));
        return obj;
    }

    @Override
    public String toString() {
        String preview = text.length() > 50 ? text.substring(0, 50) + "..." : text;
        return "Prompt{" + id + ", '" + preview + "'}";
    }
}
