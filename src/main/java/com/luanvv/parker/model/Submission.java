package com.luanvv.parker.model;

public record Submission(String role, String company, String stage, String dates, String owner) {
}
