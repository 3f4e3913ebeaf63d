package com.storesync.domain;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

/**
 * Sales channel. Identified by slug.
 */
@NoArgsConstructor
@AllArgsConstructor
@Getter
@Setter
@EqualsAndHashCode
@ToString
public class Channel {

    private String slug;
    private String name;
    private String currencyCode;
    private String defaultCountry;
    private Boolean isActive;
}
