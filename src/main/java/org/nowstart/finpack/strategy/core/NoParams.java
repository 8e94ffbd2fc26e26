package org.nowstart.finpack.strategy.core;

public record NoParams() implements RuleParams {

    public static final NoParams INSTANCE = new NoParams();
}
