package com.example.sessionrelay.model;

import java.util.Map;

public class NotificationRequest {
    private String title;
    private String message;
    private String level; // info | warning | error | success
    private Map<String, Object> data;

    public NotificationRequest() {}

    public String getTitle() { return title; }
    public void setTitle(String title) { this.title = title; }

    public String getMessage() { return message; }
    public void setMessage(String message) { this.message = message; }

    public String getLevel() { return level; }
    public void setLevel(String level) { this.level = level; }

    public Map<String, Object> getData() { return data; }
    public void setData(Map<String, Object> data) { this.data = data; }
}
