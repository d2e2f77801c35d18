package io.github.cyfko.elementql.tests;

import io.github.cyfko.elementql.core.ElementCollector;
import io.github.cyfko.elementql.core.ElementQueryFactory;
import io.github.cyfko.elementql.core.api.Criteria;
import io.github.cyfko.elementql.core.api.ParameterRule;
import io.github.cyfko.elementql.core.exception.UnknownIdentifierException;
import io.github.cyfko.elementql.core.model.CategoryId;
import io.github.cyfko.elementql.core.model.ElementId;
import io.github.cyfko.elementql.jpa.CategoryEntity;
import io.github.cyfko.elementql.jpa.ElementEntity;
import io.github.cyfko.elementql.jpa.JpaElementStore;
import io.github.cyfko.elementql.tests.entities.TextNote;
import io.github.cyfko.elementql.tests.entities.View;
import io.github.cyfko.elementql.tests.entities.Wall;
import io.github.cyfko.elementql.tests.entities.WallType;
import jakarta.persistence.EntityManager;
import jakarta.persistence.EntityManagerFactory;
import jakarta.persistence.Persistence;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("JPA element store")
class JpaElementStoreTest {

    private static final CategoryId WALLS = CategoryId.of(-2000011);
    private static final CategoryId TEXT_NOTES = CategoryId.of(-2000300);
    private static final CategoryId VIEWS = CategoryId.of(-2000279);
    private static final ElementId PLAN_VIEW = ElementId.of(500);
    private static final ElementId SECTION_VIEW = ElementId.of(501);

    private static EntityManagerFactory emf;

    private EntityManager em;
    private ElementQueryFactory<ElementEntity> query;

    @BeforeAll
    static void setup() {
        emf = Persistence.createEntityManagerFactory("testPU");

        EntityManager em = emf.createEntityManager();
        em.getTransaction().begin();
        for (String[] category : new String[][]{
                {"Walls", "-2000011"}, {"OST_Walls", "-2000011"},
                {"Text Notes", "-2000300"}, {"OST_TextNotes", "-2000300"},
                {"Views", "-2000279"}}) {
            em.persist(new CategoryEntity(category[0], CategoryId.of(Long.parseLong(category[1]))));
        }
        for (int i = 1; i <= 10; i++) {
            Wall wall = new Wall(i, "Wall " + i, WALLS);
            wall.withParameter("Height", i == 5 ? 10.0005 : i * 2.0)
                    .withParameter("Type Name", i <= 4 ? "Generic - 200mm" : i <= 7 ? "Exterior - Brick" : "Interior - Partition")
                    .withParameter("Structural", i % 2 == 0);
            if (i <= 3) wall.visibleIn(PLAN_VIEW);
            em.persist(wall);
        }
        em.persist(new WallType(101, "Generic - 200mm", WALLS)
                .withParameter("Type Name", "Generic - 200mm").withParameter("Width", 200));
        em.persist(new WallType(102, "Exterior - Brick", WALLS)
                .withParameter("Type Name", "Exterior - Brick").withParameter("Width", 250));
        em.persist(new WallType(103, "Interior - Partition", WALLS)
                .withParameter("Type Name", "Interior - Partition").withParameter("Width", 300));
        em.persist(new TextNote(201, "Plan note", TEXT_NOTES).ownedBy(PLAN_VIEW).withParameter("Text", "100% done"));
        em.persist(new TextNote(202, "Section note", TEXT_NOTES).ownedBy(SECTION_VIEW).withParameter("Text", "Check_level"));
        em.persist(new View(500, "Level 1", VIEWS));
        em.persist(new View(501, "Section A", VIEWS));
        em.getTransaction().commit();
        em.close();
    }

    @AfterAll
    static void teardown() {
        if (emf != null) emf.close();
    }

    @BeforeEach
    void openEntityManager() {
        em = emf.createEntityManager();
        query = ElementQueryFactory.of(new JpaElementStore(em));
    }

    @AfterEach
    void closeEntityManager() {
        em.close();
    }

    private static Set<Long> ids(ElementCollector<ElementEntity> collector) {
        return collector.stream().map(e -> e.getId().value()).collect(Collectors.toSet());
    }

    @Nested
    @DisplayName("Structural criteria")
    class StructuralCriteria {

        @Test
        @DisplayName("Should collect wall types by category name and type toggle")
        void shouldCollectWallTypes() {
            // When
            ElementCollector<ElementEntity> types = query.collector(Map.of("of_category", "Walls", "is_element_type", true));

            // Then
            assertEquals(Set.of(101L, 102L, 103L), ids(types));
        }

        @Test
        @DisplayName("Should resolve category aliases to the same category")
        void shouldResolveAliases() {
            assertEquals(ids(query.collector(Map.of("of_category", "Walls"))),
                    ids(query.collector(Map.of("of_category", "OST_Walls"))));
            assertEquals(13, query.collector(Map.of("of_category", WALLS)).size());
        }

        @Test
        @DisplayName("Should match the exact entity class by name or type")
        void shouldMatchExactClass() {
            assertEquals(10, query.collector(Map.of("of_class", "Wall")).size());
            assertEquals(3, query.collector(Criteria.builder().ofClass(WallType.class).build()).size());
            assertTrue(query.collector(Criteria.builder().ofClass(ElementEntity.class).build()).isEmpty());
        }

        @Test
        @DisplayName("Should report unknown category and class names")
        void shouldReportUnknownNames() {
            ElementCollector<ElementEntity> collector = query.collector();

            assertThrows(UnknownIdentifierException.class, () -> collector.filter(Map.of("of_category", "Doors")));
            assertThrows(UnknownIdentifierException.class, () -> collector.filter(Map.of("of_class", "Door")));
            assertTrue(collector.criteria().isEmpty());
        }

        @Test
        @DisplayName("Should keep view independent elements only")
        void shouldKeepViewIndependent() {
            // When
            Set<Long> independent = ids(query.collector(Map.of("is_view_independent", true)));

            // Then
            assertEquals(15, independent.size());
            assertFalse(independent.contains(201L));
            assertFalse(independent.contains(202L));
        }

        @Test
        @DisplayName("Should return elements ordered by identifier")
        void shouldOrderById() {
            List<Long> ordered = query.collector(Map.of("of_category", "Walls", "is_element", true)).stream()
                    .map(e -> e.getId().value())
                    .toList();

            assertEquals(List.of(1L, 2L, 3L, 4L, 5L, 6L, 7L, 8L, 9L, 10L), ordered);
        }
    }

    @Nested
    @DisplayName("View scope")
    class ViewScope {

        @Test
        @DisplayName("Should collect owned and visible elements of a view")
        void shouldCollectViewContent() {
            assertEquals(Set.of(1L, 2L, 3L, 201L), ids(query.collector(PLAN_VIEW, Map.of("is_element", true))));
        }

        @Test
        @DisplayName("Should combine view scope with class criteria")
        void shouldCombineWithClass() {
            assertEquals(Set.of(202L), ids(query.collector(SECTION_VIEW, Map.of("of_class", "TextNote"))));
        }
    }

    @Nested
    @DisplayName("Parameter filters")
    class ParameterFilters {

        @Test
        @DisplayName("Should compare floating-point values with tolerance")
        void shouldApplyTolerance() {
            // Given
            ParameterRule tall = query.rules().parameter("Height").greater(10.0).build();
            ParameterRule nearTen = query.rule("Height", Map.of("equals", 10.0));

            // When
            Set<Long> tallWalls = ids(query.collector(Criteria.builder().parameterFilter(tall).build()));
            Set<Long> nearTenWalls = ids(query.collector(Criteria.builder().parameterFilter(nearTen).build()));

            // Then
            assertEquals(Set.of(6L, 7L, 8L, 9L, 10L), tallWalls);
            assertEquals(Set.of(5L), nearTenWalls);
        }

        @Test
        @DisplayName("Should keep elements lacking the parameter when negated")
        void shouldNegate() {
            // Given
            ParameterRule notTall = query.rule("Height", Map.of("greater", 10.0, "negated", true));

            // When
            ElementCollector<ElementEntity> walls = query.collector(Criteria.builder()
                    .ofCategory("Walls")
                    .parameterFilter(notTall)
                    .build());

            // Then
            assertEquals(Set.of(1L, 2L, 3L, 4L, 5L, 101L, 102L, 103L), ids(walls));
        }

        @Test
        @DisplayName("Should compare integer values exactly and against floating-point operands")
        void shouldCompareIntegers() {
            assertEquals(Set.of(102L), ids(query.collector(Map.of("parameter_filter",
                    query.rule("Width", Map.of("equals", 250))))));
            assertEquals(Set.of(102L, 103L), ids(query.collector(Map.of("parameter_filter",
                    query.rule("Width", Map.of("greater_equal", 249.5))))));
            assertEquals(Set.of(101L), ids(query.collector(Map.of("parameter_filter",
                    query.rule("Width", Map.of("less", 250.0))))));
        }

        @Test
        @DisplayName("Should store booleans as integers")
        void shouldMatchBooleans() {
            ElementCollector<ElementEntity> structural = query.collector(Map.of("parameter_filter",
                    query.rule("Structural", Map.of("equals", true))));

            assertEquals(Set.of(2L, 4L, 6L, 8L, 10L), ids(structural));
        }

        @Test
        @DisplayName("Should match text case-insensitively when asked")
        void shouldMatchTextIgnoringCase() {
            ParameterRule brick = query.rules().parameter("Type Name").endsWith("BRICK").caseSensitive(false).build();
            ParameterRule strictBrick = query.rules().parameter("Type Name").endsWith("BRICK").build();

            assertEquals(Set.of(5L, 6L, 7L, 102L), ids(query.collector(Criteria.builder().parameterFilter(brick).build())));
            assertTrue(query.collector(Criteria.builder().parameterFilter(strictBrick).build()).isEmpty());
        }

        @Test
        @DisplayName("Should treat pattern characters literally")
        void shouldEscapePatterns() {
            assertEquals(Set.of(201L), ids(query.collector(Map.of("parameter_filter",
                    query.rule("Text", Map.of("contains", "0%"))))));
            assertEquals(Set.of(202L), ids(query.collector(Map.of("parameter_filter",
                    query.rule("Text", Map.of("contains", "_"))))));
            assertTrue(query.collector(Map.of("parameter_filter",
                    query.rule("Type Name", Map.of("begins", "%")))).isEmpty());
        }

        @Test
        @DisplayName("Should narrow an existing collection when chaining")
        void shouldNarrowWhenChaining() {
            // Given
            ElementCollector<ElementEntity> walls = query.collector(Map.of("of_category", "Walls"));
            assertEquals(13, walls.size());

            // When
            walls.filter(Map.of("is_element", true))
                    .filter(Map.of("parameter_filter", query.rule("Type Name", Map.of("begins", "Generic"))));

            // Then
            assertEquals(Set.of(1L, 2L, 3L, 4L), ids(walls));
        }
    }
}
