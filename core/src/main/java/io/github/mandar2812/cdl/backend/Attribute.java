package io.github.mandar2812.cdl.backend;

import io.github.mandar2812.cdl.AttributeValue;

/**
 * Named attribute of an in-memory dataset or variable.
 *
 * @since    15 Oct 2026
 */
public class Attribute {

    private final String name_;
    private final AttributeValue value_;

    /**
     * Constructor.
     *
     * @param   name   attribute name
     * @param   value  attribute value
     */
    public Attribute( String name, AttributeValue value ) {
        name_ = name;
        value_ = value;
    }

    /**
     * Returns this attribute's name.
     *
     * @return   attribute name
     */
    public String getName() {
        return name_;
    }

    /**
     * Returns this attribute's value.
     *
     * @return  value
     */
    public AttributeValue getValue() {
        return value_;
    }

    @Override
    public String toString() {
        return name_ + " = " + value_;
    }
}
