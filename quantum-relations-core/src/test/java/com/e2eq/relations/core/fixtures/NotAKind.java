package com.e2eq.relations.core.fixtures;

public class NotAKind {
}
