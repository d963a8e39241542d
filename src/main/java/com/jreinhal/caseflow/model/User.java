package com.jreinhal.caseflow.model;

/**
 * Caller identity as asserted by the gateway. A user without a firm works as a solo
 * lawyer and only sees the cases assigned to them.
 */
public class User {
    public static final String DEV_USER_ID = "000000000000000000000001";
    public static final String DEV_FIRM_ID = "000000000000000000000002";

    private String id;
    private String username;
    private String displayName;
    private String firmId;

    public User() {
    }

    public User(String id, String username, String firmId) {
        this.id = id;
        this.username = username;
        this.displayName = username;
        this.firmId = firmId;
    }

    public static User devUser(String username) {
        User user = new User();
        user.id = DEV_USER_ID;
        user.username = username;
        user.displayName = username.toUpperCase();
        user.firmId = DEV_FIRM_ID;
        return user;
    }

    public boolean isSoloLawyer() {
        return this.firmId == null || this.firmId.isBlank();
    }

    public String getId() {
        return this.id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getUsername() {
        return this.username;
    }

    public void setUsername(String username) {
        this.username = username;
    }

    public String getDisplayName() {
        return this.displayName;
    }

    public void setDisplayName(String displayName) {
        this.displayName = displayName;
    }

    public String getFirmId() {
        return this.firmId;
    }

    public void setFirmId(String firmId) {
        this.firmId = firmId;
    }
}
