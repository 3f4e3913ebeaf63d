package com.storesync.diff.comparator;

import com.storesync.diff.AbstractEntityComparator;
import com.storesync.domain.Category;
import com.storesync.domain.EntityType;

import java.util.List;

public class CategoryComparator extends AbstractEntityComparator<Category> {

    public CategoryComparator() {
        super(EntityType.CATEGORIES, Category::getSlug, Category::getName, List.of(
                FieldSpec.of("name", Category::getName),
                FieldSpec.of("description", Category::getDescription),
                FieldSpec.of("parent", Category::getParent)));
    }
}
