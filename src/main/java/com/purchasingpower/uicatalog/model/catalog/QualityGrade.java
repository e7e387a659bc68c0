package com.purchasingpower.uicatalog.model.catalog;

public enum QualityGrade {
    A, B, C, D, F;

    public static QualityGrade forScore(double score) {
        if (score >= 0.9) {
            return A;
        } else if (score >= 0.8) {
            return B;
        } else if (score >= 0.7) {
            return C;
        } else if (score >= 0.6) {
            return D;
        }
        return F;
    }
}
