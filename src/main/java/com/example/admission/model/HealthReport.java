package com.example.admission.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Health summary across all registered circuit breakers.
 */
public class HealthReport {

    private final HealthStatus status;
    private final double score;
    private final int totalBreakers;
    private final int healthy;
    private final int failing;
    private final int testing;
    private final List<String> recommendations;

    public HealthReport(int totalBreakers, int healthy, int failing, int testing) {
        this.totalBreakers = totalBreakers;
        this.healthy = healthy;
        this.failing = failing;
        this.testing = testing;
        // no breakers yet means nothing has failed
        this.score = totalBreakers == 0 ? 100.0 : healthy * 100.0 / totalBreakers;
        this.status = HealthStatus.fromScore(score);
        this.recommendations = recommend(status, failing, testing);
    }

    private static List<String> recommend(HealthStatus status, int failing, int testing) {
        List<String> tips = new ArrayList<>();
        switch (status) {
            case HEALTHY:
                tips.add("All systems operating normally");
                break;
            case DEGRADED:
                tips.add("Monitor failing providers closely");
                break;
            default:
                tips.add("System health is compromised");
                tips.add("Check provider credentials and network connectivity");
                break;
        }
        if (failing > 0) {
            tips.add(failing + " circuit(s) open; requests to those providers fail fast until the recovery timeout");
        }
        if (testing > 0) {
            tips.add(testing + " circuit(s) probing recovery");
        }
        return List.copyOf(tips);
    }

    public HealthStatus getStatus() {
        return status;
    }

    public double getScore() {
        return score;
    }

    public int getTotalBreakers() {
        return totalBreakers;
    }

    public int getHealthy() {
        return healthy;
    }

    public int getFailing() {
        return failing;
    }

    public int getTesting() {
        return testing;
    }

    public List<String> getRecommendations() {
        return recommendations;
    }
}
