package com.portsyncro.snapshot;

public class PortfolioNotFoundException extends RuntimeException {

    public PortfolioNotFoundException(String userId) {
        super("No portfolio for user " + userId);
    }
}
