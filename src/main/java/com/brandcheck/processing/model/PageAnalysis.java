package com.brandcheck.processing.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Result returned by the analysis provider for one page.
 * Mutable bean so it can be read back from cache files by Jackson.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class PageAnalysis {

    private double overallScore;
    private double brandComplianceScore;
    private List<String> criticalViolations = new ArrayList<>();
    private List<String> violations = new ArrayList<>();
    private List<String> recommendations = new ArrayList<>();
    private String summary;

    public PageAnalysis() {
    }

    public PageAnalysis(double overallScore, double brandComplianceScore,
                        List<String> criticalViolations, List<String> violations) {
        this.overallScore = overallScore;
        this.brandComplianceScore = brandComplianceScore;
        setCriticalViolations(criticalViolations);
        setViolations(violations);
    }

    public double getOverallScore() {
        return overallScore;
    }

    public void setOverallScore(double overallScore) {
        this.overallScore = overallScore;
    }

    public double getBrandComplianceScore() {
        return brandComplianceScore;
    }

    public void setBrandComplianceScore(double brandComplianceScore) {
        this.brandComplianceScore = brandComplianceScore;
    }

    public List<String> getCriticalViolations() {
        return criticalViolations;
    }

    public void setCriticalViolations(List<String> criticalViolations) {
        this.criticalViolations = criticalViolations != null ? new ArrayList<>(criticalViolations) : new ArrayList<>();
    }

    public List<String> getViolations() {
        return violations;
    }

    public void setViolations(List<String> violations) {
        this.violations = violations != null ? new ArrayList<>(violations) : new ArrayList<>();
    }

    public List<String> getRecommendations() {
        return recommendations;
    }

    public void setRecommendations(List<String> recommendations) {
        this.recommendations = recommendations != null ? new ArrayList<>(recommendations) : new ArrayList<>();
    }

    public String getSummary() {
        return summary;
    }

    public void setSummary(String summary) {
        this.summary = summary;
    }
}
