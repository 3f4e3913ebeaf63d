package com.storesync.domain;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

import java.util.List;

@NoArgsConstructor
@AllArgsConstructor
@Getter
@Setter
@EqualsAndHashCode
@ToString
public class ProductType {

    private String name;
    private Boolean isShippingRequired;
    /** Attribute names assigned at product level. */
    private List<String> productAttributes;
    /** Attribute names assigned at variant level. */
    private List<String> variantAttributes;
}
