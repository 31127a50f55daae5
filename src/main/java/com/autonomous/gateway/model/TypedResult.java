package com.autonomous.gateway.model;

import lombok.Value;

import java.util.List;

@Value
public class TypedResult<T> {
    T value;
    List<TypedAttempt> attempts;
}
