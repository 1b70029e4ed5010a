package com.parallax.agent;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Settings for the tool-calling agent: where its tools operate and how much
 * output they return to the model.
 */
@Component
@ConfigurationProperties(prefix = "parallax.agent")
public class AgentProperties {

    private String workspace = ".";
    private int maxOutputChars = 20000;
    private int bashTimeoutSeconds = 120;

    public String getWorkspace() { return workspace; }
    public void setWorkspace(String workspace) { this.workspace = workspace; }
    public int getMaxOutputChars() { return maxOutputChars; }
    public void setMaxOutputChars(int maxOutputChars) { this.maxOutputChars = maxOutputChars; }
    public int getBashTimeoutSeconds() { return bashTimeoutSeconds; }
    public void setBashTimeoutSeconds(int bashTimeoutSeconds) { this.bashTimeoutSeconds = bashTimeoutSeconds; }
}
