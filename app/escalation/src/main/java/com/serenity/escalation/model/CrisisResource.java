package com.serenity.escalation.model;

public record CrisisResource(String name, String contact, String description) {}
