package io.github.cyfko.elementql.tests.entities;

import io.github.cyfko.elementql.core.model.CategoryId;
import io.github.cyfko.elementql.jpa.ElementEntity;
import jakarta.persistence.DiscriminatorValue;
import jakarta.persistence.Entity;

/** A view-specific annotation. */
@Entity
@DiscriminatorValue("TextNote")
public class TextNote extends ElementEntity {

    protected TextNote() {
    }

    public TextNote(long id, String name, CategoryId category) {
        super(id, name, category, false);
    }
}
