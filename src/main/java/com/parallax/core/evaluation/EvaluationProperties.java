package com.parallax.core.evaluation;

import com.parallax.core.model.CheckType;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Stage switches, thresholds and mechanical check commands.
 */
@Component
@ConfigurationProperties(prefix = "parallax.evaluation")
public class EvaluationProperties {

    private boolean stage1Enabled = true;
    private boolean stage2Enabled = true;
    private boolean stage3Enabled = true;
    private double satisfactionThreshold = 0.8;
    private double driftTriggerThreshold = 0.3;
    private double uncertaintyTriggerThreshold = 0.3;
    private DriftWeights driftWeights = new DriftWeights();
    private Mechanical mechanical = new Mechanical();

    public boolean isStage1Enabled() { return stage1Enabled; }
    public void setStage1Enabled(boolean stage1Enabled) { this.stage1Enabled = stage1Enabled; }
    public boolean isStage2Enabled() { return stage2Enabled; }
    public void setStage2Enabled(boolean stage2Enabled) { this.stage2Enabled = stage2Enabled; }
    public boolean isStage3Enabled() { return stage3Enabled; }
    public void setStage3Enabled(boolean stage3Enabled) { this.stage3Enabled = stage3Enabled; }
    public double getSatisfactionThreshold() { return satisfactionThreshold; }
    public void setSatisfactionThreshold(double satisfactionThreshold) { this.satisfactionThreshold = satisfactionThreshold; }
    public double getDriftTriggerThreshold() { return driftTriggerThreshold; }
    public void setDriftTriggerThreshold(double driftTriggerThreshold) { this.driftTriggerThreshold = driftTriggerThreshold; }
    public double getUncertaintyTriggerThreshold() { return uncertaintyTriggerThreshold; }
    public void setUncertaintyTriggerThreshold(double uncertaintyTriggerThreshold) { this.uncertaintyTriggerThreshold = uncertaintyTriggerThreshold; }
    public DriftWeights getDriftWeights() { return driftWeights; }
    public void setDriftWeights(DriftWeights driftWeights) { this.driftWeights = driftWeights; }
    public Mechanical getMechanical() { return mechanical; }
    public void setMechanical(Mechanical mechanical) { this.mechanical = mechanical; }

    public static class DriftWeights {
        private double goal = 0.5;
        private double constraint = 0.3;
        private double ontology = 0.2;

        public double getGoal() { return goal; }
        public void setGoal(double goal) { this.goal = goal; }
        public double getConstraint() { return constraint; }
        public void setConstraint(double constraint) { this.constraint = constraint; }
        public double getOntology() { return ontology; }
        public void setOntology(double ontology) { this.ontology = ontology; }
    }

    public static class Mechanical {
        private String workingDirectory = ".";
        private int timeoutSeconds = 300;
        private double coverageThreshold = 0.7;
        private Map<String, Check> checks = new LinkedHashMap<>();

        public String getWorkingDirectory() { return workingDirectory; }
        public void setWorkingDirectory(String workingDirectory) { this.workingDirectory = workingDirectory; }
        public int getTimeoutSeconds() { return timeoutSeconds; }
        public void setTimeoutSeconds(int timeoutSeconds) { this.timeoutSeconds = timeoutSeconds; }
        public double getCoverageThreshold() { return coverageThreshold; }
        public void setCoverageThreshold(double coverageThreshold) { this.coverageThreshold = coverageThreshold; }
        public Map<String, Check> getChecks() { return checks; }
        public void setChecks(Map<String, Check> checks) { this.checks = checks; }
    }

    public static class Check {
        private CheckType type = CheckType.BUILD;
        private String command = "";

        public Check() {}

        public Check(CheckType type, String command) {
            this.type = type;
            this.command = command;
        }

        public CheckType getType() { return type; }
        public void setType(CheckType type) { this.type = type; }
        public String getCommand() { return command; }
        public void setCommand(String command) { this.command = command; }
    }
}
