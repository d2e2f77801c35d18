package io.github.cyfko.elementql.jpa;

import io.github.cyfko.elementql.core.model.CategoryId;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.util.Objects;

/**
 * Category name stored in the database. Several rows may share one category identifier,
 * one per alias.
 *
 * @since 1.0.0
 */
@Entity
@Table(name = "categories")
public class CategoryEntity {

    @Id
    @Column(name = "name")
    private String name;

    @Column(name = "category_id", nullable = false)
    private Long categoryId;

    protected CategoryEntity() {
    }

    public CategoryEntity(String name, CategoryId category) {
        this.name = Objects.requireNonNull(name, "name cannot be null");
        this.categoryId = Objects.requireNonNull(category, "category cannot be null").value();
    }

    public String getName() {
        return name;
    }

    public CategoryId getCategory() {
        return CategoryId.of(categoryId);
    }
}
