package io.github.cyfko.elementql.core;

import io.github.cyfko.elementql.core.api.Criteria;
import io.github.cyfko.elementql.core.api.Criterion;
import io.github.cyfko.elementql.core.api.ParameterRule;
import io.github.cyfko.elementql.core.exception.CriterionValueException;
import io.github.cyfko.elementql.core.exception.UnknownIdentifierException;
import io.github.cyfko.elementql.core.exception.UnsupportedFilterException;
import io.github.cyfko.elementql.core.fixtures.Documents;
import io.github.cyfko.elementql.core.fixtures.TextNote;
import io.github.cyfko.elementql.core.fixtures.Wall;
import io.github.cyfko.elementql.core.fixtures.WallType;
import io.github.cyfko.elementql.core.memory.InMemoryElementStore;
import io.github.cyfko.elementql.core.memory.MemoryElement;
import io.github.cyfko.elementql.core.model.ElementId;
import io.github.cyfko.elementql.core.rule.RuleBuilder;
import io.github.cyfko.elementql.core.spi.ElementStore;
import io.github.cyfko.elementql.core.spi.QueryHandle;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("ElementCollector Tests")
class ElementCollectorTest {

    private InMemoryElementStore store;
    private RuleBuilder rules;

    @BeforeEach
    void setUp() {
        store = Documents.sample();
        rules = new RuleBuilder(store.ruleFactory());
    }

    private static Set<Long> ids(ElementCollector<MemoryElement> collector) {
        return collector.stream().map(e -> e.getId().value()).collect(Collectors.toSet());
    }

    @Nested
    @DisplayName("Construction")
    class Construction {

        @Test
        @DisplayName("Empty collector holds nothing until filtered")
        void emptyCollectorHoldsNothing() {
            ElementCollector<MemoryElement> collector = new ElementCollector<>(store);

            assertTrue(collector.isEmpty());
            assertEquals(0, collector.size());
            assertTrue(collector.criteria().isEmpty());
            assertTrue(collector.first().isEmpty());
            assertTrue(collector.view().isEmpty());
        }

        @Test
        @DisplayName("Initial criteria are applied immediately")
        void initialCriteriaAreApplied() {
            ElementCollector<MemoryElement> collector = new ElementCollector<>(store,
                    Criteria.builder().ofClass(WallType.class).build());

            assertEquals(3, collector.size());
            assertTrue(collector.criteria().contains(Criterion.OF_CLASS));
        }

        @Test
        @DisplayName("View-scoped collector only sees owned and visible elements")
        void viewScopedCollector() {
            ElementCollector<MemoryElement> collector = new ElementCollector<>(store, Documents.PLAN_VIEW);

            collector.filter(Criteria.empty());

            assertEquals(Set.of(1L, 2L, 3L, 201L), ids(collector));
            assertEquals(Documents.PLAN_VIEW, collector.view().orElseThrow());
        }

        @Test
        @DisplayName("View scope combines with criteria")
        void viewScopeCombinesWithCriteria() {
            ElementCollector<MemoryElement> collector = new ElementCollector<>(store, Documents.PLAN_VIEW,
                    Criteria.builder().ofClass("TextNote").build());

            assertEquals(1, collector.size());
            assertEquals(201L, collector.first().orElseThrow().getId().value());
        }

        @Test
        @DisplayName("Null store is rejected")
        void nullStoreIsRejected() {
            assertThrows(NullPointerException.class, () -> new ElementCollector<MemoryElement>(null));
        }
    }

    @Nested
    @DisplayName("Filtering")
    class Filtering {

        @Test
        @DisplayName("Walls category restricted to element types yields the 3 wall types")
        void wallTypes() {
            // When
            ElementCollector<MemoryElement> collector = new ElementCollector<>(store)
                    .filter(Map.of("of_category", "Walls", "is_element_type", true));

            // Then
            assertEquals(3, collector.size());
            assertFalse(collector.isEmpty());
            assertEquals(101L, collector.first().orElseThrow().getId().value());
            assertTrue(collector.stream().allMatch(e -> e instanceof WallType));
        }

        @Test
        @DisplayName("Class shorthand resolves against the class namespace")
        void classShorthand() {
            ElementCollector<MemoryElement> collector = new ElementCollector<>(store)
                    .filter(Map.of("of_class", "Wall"));

            assertEquals(10, collector.size());
            assertTrue(collector.stream().allMatch(e -> e.getClass() == Wall.class));
        }

        @Test
        @DisplayName("is_element excludes type definitions")
        void isElement() {
            ElementCollector<MemoryElement> collector = new ElementCollector<>(store)
                    .filter(Criteria.builder().isElement(true).build());

            assertEquals(Documents.ELEMENT_COUNT - 3, collector.size());
        }

        @Test
        @DisplayName("is_view_independent excludes view-owned elements")
        void isViewIndependent() {
            ElementCollector<MemoryElement> collector = new ElementCollector<>(store)
                    .filter(Criteria.builder().isViewIndependent(true).build());

            assertEquals(Documents.ELEMENT_COUNT - 2, collector.size());
            assertTrue(collector.stream().noneMatch(e -> e instanceof TextNote));
        }

        @Test
        @DisplayName("Empty criteria on a fresh collector collects the whole scope")
        void emptyCriteriaOnFreshCollector() {
            ElementCollector<MemoryElement> collector = new ElementCollector<>(store).filter(Map.of());

            assertEquals(Documents.ELEMENT_COUNT, collector.size());
        }

        @Test
        @DisplayName("Results follow the engine's enumeration order")
        void resultsFollowEngineOrder() {
            ElementCollector<MemoryElement> collector = new ElementCollector<>(store)
                    .filter(Criteria.builder().ofClass(Wall.class).build());

            List<Long> order = new ArrayList<>();
            for (MemoryElement element : collector) {
                order.add(element.getId().value());
            }
            assertEquals(List.of(1L, 2L, 3L, 4L, 5L, 6L, 7L, 8L, 9L, 10L), order);
        }

        @Test
        @DisplayName("Elements are exposed read-only")
        void elementsAreReadOnly() {
            ElementCollector<MemoryElement> collector = new ElementCollector<>(store).filter(Map.of());

            assertThrows(UnsupportedOperationException.class, () -> collector.elements().clear());
        }

        @Test
        @DisplayName("A collector reflects the store as it is at filter time")
        void reflectsStoreAtCallTime() {
            ElementCollector<MemoryElement> collector = new ElementCollector<>(store)
                    .filter(Criteria.builder().ofClass(WallType.class).build());
            assertEquals(3, collector.size());

            store.add(new WallType(104, "Curtain Wall", Documents.WALLS));

            assertEquals(3, collector.size(), "Materialized elements do not change by themselves");
            collector.filter(Criteria.builder().isElementType(true).build());
            assertEquals(4, collector.size());
        }
    }

    @Nested
    @DisplayName("Accumulation")
    class Accumulation {

        @Test
        @DisplayName("Successive filters keep previous criteria")
        void successiveFiltersKeepPreviousCriteria() {
            // Given
            ElementCollector<MemoryElement> collector = new ElementCollector<>(store)
                    .filter(Map.of("of_category", "Walls"));
            assertEquals(13, collector.size());

            // When
            collector.filter(Map.of("is_element_type", true));

            // Then
            assertEquals(3, collector.size());
            assertEquals(2, collector.criteria().size());
        }

        @Test
        @DisplayName("Narrowing is monotonic")
        void narrowingIsMonotonic() {
            ElementCollector<MemoryElement> collector = new ElementCollector<>(store).filter(Map.of());
            Set<Long> all = ids(collector);

            collector.filter(Map.of("of_category", "Walls"));
            Set<Long> walls = ids(collector);
            assertTrue(all.containsAll(walls));

            collector.filter(Map.of("is_element", true));
            Set<Long> wallInstances = ids(collector);
            assertTrue(walls.containsAll(wallInstances));

            collector.filter(Criteria.builder().parameterFilter(rules.parameter("Height").greater(10.0).build()).build());
            assertTrue(wallInstances.containsAll(ids(collector)));
            assertEquals(Set.of(6L, 7L, 8L, 9L, 10L), ids(collector));
        }

        @Test
        @DisplayName("Newer values replace accumulated values of the same criterion")
        void newerValuesWin() {
            ElementCollector<MemoryElement> collector = new ElementCollector<>(store)
                    .filter(Map.of("of_class", "Wall"));
            assertEquals(10, collector.size());

            collector.filter(Map.of("of_class", "WallType"));

            assertEquals(3, collector.size());
            assertEquals(1, collector.criteria().size());
        }

        @Test
        @DisplayName("Empty criteria on a materialized collector change nothing")
        void emptyFilterIsIdempotent() {
            ElementStore<MemoryElement> spied = spy(store);
            ElementCollector<MemoryElement> collector = new ElementCollector<>(spied)
                    .filter(Map.of("of_category", "Walls", "is_element_type", true));
            List<MemoryElement> before = collector.elements();
            Criteria criteriaBefore = collector.criteria();

            ElementCollector<MemoryElement> returned = collector.filter(Map.of());

            assertSame(collector, returned);
            assertSame(before, collector.elements());
            assertEquals(criteriaBefore, collector.criteria());
            verify(spied, times(1)).collect();
        }
    }

    @Nested
    @DisplayName("Criteria semantics")
    class CriteriaSemantics {

        @Test
        @DisplayName("Order of class, type and view criteria does not matter")
        void orderIndependence() {
            List<Map.Entry<String, Object>> entries = List.of(
                    Map.entry("of_class", "Wall"),
                    Map.entry("is_element_type", false),
                    Map.entry("is_view_independent", true));

            Set<Set<Long>> results = new HashSet<>();
            for (List<Map.Entry<String, Object>> permutation : permutations(entries)) {
                Map<String, Object> raw = new LinkedHashMap<>();
                permutation.forEach(e -> raw.put(e.getKey(), e.getValue()));
                results.add(ids(new ElementCollector<>(store).filter(raw)));
            }

            assertEquals(1, results.size());
            assertEquals(10, results.iterator().next().size());
        }

        @Test
        @DisplayName("A false toggle behaves like an absent one while true narrows")
        void booleanAsymmetry() {
            Set<Long> absent = ids(new ElementCollector<>(store).filter(Map.of("of_category", "Walls")));
            Set<Long> falseToggle = ids(new ElementCollector<>(store)
                    .filter(Map.of("of_category", "Walls", "is_element_type", false)));
            Set<Long> trueToggle = ids(new ElementCollector<>(store)
                    .filter(Map.of("of_category", "Walls", "is_element_type", true)));

            assertEquals(absent, falseToggle);
            assertEquals(Set.of(101L, 102L, 103L), trueToggle);
        }

        @Test
        @DisplayName("Category name and resolved identifier select the same elements")
        void coercionEquivalence() {
            Set<Long> byName = ids(new ElementCollector<>(store).filter(Map.of("of_category", "Walls")));
            Set<Long> byAlias = ids(new ElementCollector<>(store).filter(Map.of("of_category", "OST_Walls")));
            Set<Long> byId = ids(new ElementCollector<>(store).filter(Map.of("of_category", Documents.WALLS)));

            assertEquals(byName, byId);
            assertEquals(byName, byAlias);
        }

        @Test
        @DisplayName("Class name and class object select the same elements")
        void classCoercionEquivalence() {
            Set<Long> byName = ids(new ElementCollector<>(store).filter(Map.of("of_class", "TextNote")));
            Set<Long> byClass = ids(new ElementCollector<>(store).filter(Map.of("of_class", TextNote.class)));

            assertEquals(byName, byClass);
            assertEquals(Set.of(201L, 202L), byName);
        }

        @Test
        @DisplayName("Parameter rule keeps elements whose height exceeds 10.0 within tolerance")
        void parameterRuleGreater() {
            ParameterRule tall = rules.build("Height", Map.of("greater", 10.0));

            ElementCollector<MemoryElement> collector = new ElementCollector<>(store)
                    .filter(Criteria.builder().parameterFilter(tall).build());

            // Wall 5 (10.0005) is within tolerance of 10.0, so it is not greater
            assertEquals(Set.of(6L, 7L, 8L, 9L, 10L), ids(collector));
        }

        @Test
        @DisplayName("Negated rule keeps exactly the elements the rule rejects")
        void negatedRule() {
            ParameterRule notTall = rules.build("Height", Map.of("greater", 10.0, "reverse", true));

            ElementCollector<MemoryElement> collector = new ElementCollector<>(store)
                    .filter(Map.of("of_class", "Wall", "parameter_filter", notTall));

            assertEquals(Set.of(1L, 2L, 3L, 4L, 5L), ids(collector));
        }
    }

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        @DisplayName("Unsupported criterion name leaves state untouched")
        void unsupportedCriterion() {
            ElementCollector<MemoryElement> collector = new ElementCollector<>(store)
                    .filter(Map.of("of_category", "Walls"));
            List<MemoryElement> before = collector.elements();
            Criteria criteriaBefore = collector.criteria();

            UnsupportedFilterException ex = assertThrows(UnsupportedFilterException.class,
                    () -> collector.filter(Map.of("bogus_key", 1)));

            assertEquals("bogus_key", ex.getFilterName());
            assertTrue(ex.getMessage().contains("bogus_key"));
            assertSame(before, collector.elements());
            assertEquals(criteriaBefore, collector.criteria());
        }

        @Test
        @DisplayName("Unknown category name is reported with its criterion")
        void unknownCategory() {
            ElementCollector<MemoryElement> collector = new ElementCollector<>(store);

            UnknownIdentifierException ex = assertThrows(UnknownIdentifierException.class,
                    () -> collector.filter(Map.of("of_category", "Furniture")));

            assertEquals(Criterion.OF_CATEGORY, ex.getCriterion());
            assertEquals("Furniture", ex.getName());
            assertTrue(collector.isEmpty());
            assertTrue(collector.criteria().isEmpty());
        }

        @Test
        @DisplayName("Unknown class name fails and keeps previous criteria")
        void unknownClass() {
            ElementCollector<MemoryElement> collector = new ElementCollector<>(store)
                    .filter(Map.of("is_element_type", true));

            assertThrows(UnknownIdentifierException.class, () -> collector.filter(Map.of("of_class", "Documents")));

            assertEquals(3, collector.size());
            assertFalse(collector.criteria().contains(Criterion.OF_CLASS));
        }

        @Test
        @DisplayName("Wrongly typed toggle value is rejected")
        void wronglyTypedToggle() {
            ElementCollector<MemoryElement> collector = new ElementCollector<>(store);

            assertThrows(CriterionValueException.class, () -> collector.filter(Map.of("is_element", "yes")));
        }

        @Test
        @DisplayName("Engine error propagates unchanged and leaves state untouched")
        @SuppressWarnings("unchecked")
        void engineErrorIsAtomic() {
            // Given
            ElementStore<MemoryElement> failing = mock(ElementStore.class);
            QueryHandle<MemoryElement> handle = mock(QueryHandle.class);
            when(failing.categories()).thenReturn(Documents.categories());
            when(failing.classes()).thenReturn(Documents.classes());
            when(failing.collect()).thenReturn(handle);
            when(handle.whereElementIsElementType()).thenReturn(handle);
            when(handle.ofClass(Wall.class)).thenReturn(handle);
            MemoryElement type = new WallType(101, "Generic", Documents.WALLS);
            IllegalStateException boom = new IllegalStateException("document closed");
            when(handle.toElements()).thenReturn(List.of(type)).thenThrow(boom);

            ElementCollector<MemoryElement> collector = new ElementCollector<>(failing)
                    .filter(Map.of("is_element_type", true));

            // When
            IllegalStateException thrown = assertThrows(IllegalStateException.class,
                    () -> collector.filter(Map.of("of_class", "Wall")));

            // Then
            assertSame(boom, thrown);
            assertEquals(List.of(type), collector.elements());
            assertEquals(1, collector.criteria().size());
        }
    }

    @Test
    @DisplayName("toString reports the element count")
    void toStringReportsCount() {
        ElementCollector<MemoryElement> collector = new ElementCollector<>(store)
                .filter(Map.of("is_element_type", true));

        assertTrue(collector.toString().contains("size=3"));
    }

    private static <T> List<List<T>> permutations(List<T> items) {
        if (items.isEmpty()) {
            List<List<T>> single = new ArrayList<>();
            single.add(new ArrayList<>());
            return single;
        }
        List<List<T>> result = new ArrayList<>();
        for (int i = 0; i < items.size(); i++) {
            List<T> rest = new ArrayList<>(items);
            T head = rest.remove(i);
            for (List<T> tail : permutations(rest)) {
                tail.add(0, head);
                result.add(tail);
            }
        }
        return result;
    }
}
