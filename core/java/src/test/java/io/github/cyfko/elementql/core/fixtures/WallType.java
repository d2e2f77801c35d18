package io.github.cyfko.elementql.core.fixtures;

import io.github.cyfko.elementql.core.memory.MemoryElement;
import io.github.cyfko.elementql.core.model.CategoryId;

public class WallType extends MemoryElement {

    public WallType(long id, String name, CategoryId category) {
        super(id, name, category, true);
    }
}
