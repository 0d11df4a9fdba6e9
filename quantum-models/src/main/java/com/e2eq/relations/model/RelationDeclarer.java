package com.e2eq.relations.model;

/**
 * Lambda form of {@link RecordKind#declareRelations(RelationDeclarations)}.
 */
@FunctionalInterface
public interface RelationDeclarer {
    void declare(RelationDeclarations relations);
}
