package com.storesync.diff.comparator;

import com.storesync.diff.AbstractEntityComparator;
import com.storesync.domain.Attribute;
import com.storesync.domain.EntityType;

import java.util.List;

/**
 * Attributes are keyed by name; value order does not matter.
 */
public class AttributeComparator extends AbstractEntityComparator<Attribute> {

    public AttributeComparator() {
        super(EntityType.ATTRIBUTES, Attribute::getName, List.of(
                FieldSpec.of("inputType", Attribute::getInputType),
                FieldSpec.unordered("values", Attribute::getValues)));
    }
}
