package com.storesync.domain;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

/**
 * Stock location. Identified by slug; address fields are flattened.
 */
@NoArgsConstructor
@AllArgsConstructor
@Getter
@Setter
@EqualsAndHashCode
@ToString
public class Warehouse {

    private String slug;
    private String name;
    private String email;
    private String streetAddress1;
    private String city;
    private String postalCode;
    /** ISO 3166-1 alpha-2. */
    private String country;
}
