package com.e2eq.relations.core.fixtures;

import com.e2eq.relations.model.RecordKind;
import com.e2eq.relations.model.RelationDeclarations;

public class PersonKind extends RecordKind {

    public PersonKind() {
        super("Person");
    }

    @Override
    public void declareRelations(RelationDeclarations relations) {
        relations.hasMany("./PetKind");
        relations.belongsTo("/com/e2eq/relations/core/fixtures/Household");
    }
}
