package com.classpulse.engage.session;

public interface JoinTokenGenerator {
    String next();
}
