package com.ewsmon.reference.seed;

/** Row to insert into {@code api_target} when no target with the same name exists. */
public record TargetSeed(String name, String url, String soapAction, String apiType) {}
