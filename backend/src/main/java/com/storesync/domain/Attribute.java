package com.storesync.domain;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

import java.util.List;

/**
 * Product attribute, identified by name. Values are compared as a set.
 */
@NoArgsConstructor
@AllArgsConstructor
@Getter
@Setter
@EqualsAndHashCode
@ToString
public class Attribute {

    private String name;
    /** DROPDOWN, MULTISELECT, PLAIN_TEXT, ... */
    private String inputType;
    private List<String> values;
}
