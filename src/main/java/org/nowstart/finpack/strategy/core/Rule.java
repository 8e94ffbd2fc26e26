package org.nowstart.finpack.strategy.core;

public interface Rule<P extends RuleParams> {

    String id();

    Class<P> parameterType();

    P defaultParams();
}
