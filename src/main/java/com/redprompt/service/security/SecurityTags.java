package com.redprompt.service.security;

/**
 * 安全标签常量。prompt 侧与 response 侧共用同一命名空间，便于结果合并后统一展示。
 */
public final class SecurityTags {
    // prompt side
    public static final String JAILBREAK_ATTEMPT = "Jailbreak Attempt";
    public static final String INJECTION_ATTEMPT = "Injection Attempt";
    public static final String SOCIAL_ENGINEERING = "Social Engineering";
    public static final String FORMATTED_INPUT = "Formatted Input";
    public static final String LONG_PROMPT = "Long Prompt";
    public static final String STRUCTURED_INPUT = "Structured Input";

    // response side
    public static final String SECURITY_REFUSAL = "Security Refusal";
    public static final String JAILBREAK_FAILED = "Jailbreak Failed";
    public static final String POTENTIAL_JAILBREAK_SUCCESS = "Potential Jailbreak Success";
    public static final String SECURITY_CONCERN = "Security Concern";
    public static final String INFORMATION_DISCLOSURE = "Information Disclosure";
    public static final String SYSTEM_INFORMATION = "System Information";
    public static final String LONG_RESPONSE = "Long Response";

    private SecurityTags() {
    }
}
