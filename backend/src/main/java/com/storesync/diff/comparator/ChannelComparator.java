package com.storesync.diff.comparator;

import com.storesync.diff.AbstractEntityComparator;
import com.storesync.domain.Channel;
import com.storesync.domain.EntityType;

import java.util.List;

public class ChannelComparator extends AbstractEntityComparator<Channel> {

    public ChannelComparator() {
        super(EntityType.CHANNELS, Channel::getSlug, Channel::getName, List.of(
                FieldSpec.of("name", Channel::getName),
                FieldSpec.of("currencyCode", Channel::getCurrencyCode),
                FieldSpec.of("defaultCountry", Channel::getDefaultCountry),
                FieldSpec.of("isActive", Channel::getIsActive)));
    }
}
