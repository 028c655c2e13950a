package org.arcanabar.exception;

public class QuotaExceededException extends RuntimeException {

    private final String userId;
    private final int limit;
    private final int used;

    public QuotaExceededException(String userId, int limit, int used) {
        super("User " + userId + " used " + used + " of " + limit + " free readings");
        this.userId = userId;
        this.limit = limit;
        this.used = used;
    }

    public String getUserId() {
        return userId;
    }

    public int getLimit() {
        return limit;
    }

    public int getUsed() {
        return used;
    }
}
