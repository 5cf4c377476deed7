package io.github.samzhu.advisor.dto;

/**
 * (agent, model) 分組鍵。
 */
public record AgentModelKey(
    String agentName,
    String model
) {}
