package com.fuelcopilot.behavior.model;

/**
 * Letter grade derived from the overall heavy-foot score
 */
public enum DriverGrade {
    A(90.0),
    B(80.0),
    C(70.0),
    D(60.0),
    F(0.0);

    private final double minimumScore;

    DriverGrade(double minimumScore) {
        this.minimumScore = minimumScore;
    }

    public double getMinimumScore() {
        return minimumScore;
    }

    public static DriverGrade fromScore(double score) {
        if (score >= A.minimumScore) {
            return A;
        } else if (score >= B.minimumScore) {
            return B;
        } else if (score >= C.minimumScore) {
            return C;
        } else if (score >= D.minimumScore) {
            return D;
        }
        return F;
    }
}
