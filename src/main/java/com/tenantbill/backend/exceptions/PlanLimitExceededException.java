package com.tenantbill.backend.exceptions;

import org.springframework.http.HttpStatus;

public class PlanLimitExceededException extends ApiException {

    public PlanLimitExceededException(String message) {
        super(HttpStatus.FORBIDDEN, "PLAN_LIMIT_REACHED", message);
    }
}
