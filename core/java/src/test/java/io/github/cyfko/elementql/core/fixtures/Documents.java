package io.github.cyfko.elementql.core.fixtures;

import io.github.cyfko.elementql.core.memory.InMemoryElementStore;
import io.github.cyfko.elementql.core.memory.MemoryElement;
import io.github.cyfko.elementql.core.model.CategoryId;
import io.github.cyfko.elementql.core.model.ElementId;
import io.github.cyfko.elementql.core.registry.ClassNamespace;
import io.github.cyfko.elementql.core.registry.MapCategoryRegistry;

/**
 * Sample document shared by the collector tests.
 * <ul>
 *   <li>10 walls (ids 1-10), view independent, {@code Height} 2.0 to 20.0 except wall 5 at 10.0005;
 *       walls 1-3 are visible in the plan view</li>
 *   <li>3 wall types (ids 101-103)</li>
 *   <li>2 text notes: 201 owned by the plan view, 202 owned by the section view</li>
 *   <li>2 views: plan (500) and section (501)</li>
 * </ul>
 */
public final class Documents {

    public static final CategoryId WALLS = CategoryId.of(-2000011);
    public static final CategoryId TEXT_NOTES = CategoryId.of(-2000300);
    public static final CategoryId VIEWS = CategoryId.of(-2000279);

    public static final ElementId PLAN_VIEW = ElementId.of(500);
    public static final ElementId SECTION_VIEW = ElementId.of(501);

    public static final int ELEMENT_COUNT = 17;

    private static final String[] TYPE_NAMES = {"Generic - 200mm", "Exterior - Brick", "Interior - Partition"};

    private Documents() {
    }

    public static MapCategoryRegistry categories() {
        return new MapCategoryRegistry()
                .register("Walls", WALLS)
                .register("OST_Walls", WALLS)
                .register("Text Notes", TEXT_NOTES)
                .register("OST_TextNotes", TEXT_NOTES)
                .register("Views", VIEWS);
    }

    public static ClassNamespace classes() {
        return new ClassNamespace(Wall.class.getPackageName(), MemoryElement.class);
    }

    public static InMemoryElementStore sample() {
        InMemoryElementStore store = new InMemoryElementStore(categories(), classes());

        for (int i = 1; i <= 10; i++) {
            double height = i == 5 ? 10.0005 : i * 2.0;
            String typeName = TYPE_NAMES[i <= 4 ? 0 : i <= 7 ? 1 : 2];
            MemoryElement wall = new Wall(i, "Wall " + i, WALLS)
                    .withParameter("Height", height)
                    .withParameter("Type Name", typeName)
                    .withParameter("Structural", i % 2 == 0);
            if (i <= 3) {
                wall.visibleIn(PLAN_VIEW);
            }
            store.add(wall);
        }

        for (int i = 0; i < TYPE_NAMES.length; i++) {
            store.add(new WallType(101 + i, TYPE_NAMES[i], WALLS)
                    .withParameter("Type Name", TYPE_NAMES[i])
                    .withParameter("Width", 200 + 50 * i));
        }

        store.add(new TextNote(201, "Note A", TEXT_NOTES)
                .withParameter("Text", "Check fire rating")
                .ownedBy(PLAN_VIEW));
        store.add(new TextNote(202, "Note B", TEXT_NOTES)
                .withParameter("Text", "See detail 4")
                .ownedBy(SECTION_VIEW));

        store.add(new View(500, "Level 1", VIEWS));
        store.add(new View(501, "Section 1", VIEWS));
        return store;
    }
}
