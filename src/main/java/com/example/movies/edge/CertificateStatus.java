package com.example.movies.edge;

public enum CertificateStatus {
    PENDING_VALIDATION,
    ISSUED,
    FAILED,
    EXPIRED,
    REVOKED;

    /** Maps an ACM status string; anything unknown counts as not validated. */
    public static CertificateStatus fromAcm(String status) {
        if (status == null) {
            return PENDING_VALIDATION;
        }
        switch (status) {
            case "ISSUED":
                return ISSUED;
            case "FAILED":
            case "VALIDATION_TIMED_OUT":
                return FAILED;
            case "EXPIRED":
                return EXPIRED;
            case "REVOKED":
                return REVOKED;
            default:
                return PENDING_VALIDATION;
        }
    }
}
