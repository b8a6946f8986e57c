package com.deliium.drawingboard.store;

import java.time.Instant;

public record User(long id, String email, String passwordHash, Instant createdAt) {}
