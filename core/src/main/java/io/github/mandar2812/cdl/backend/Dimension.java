package io.github.mandar2812.cdl.backend;

/**
 * Dimension of an in-memory dataset.
 *
 * @since    15 Oct 2026
 */
public class Dimension {

    private final String name_;
    private final boolean isUnlimited_;
    private int length_;

    /**
     * Constructor.
     *
     * @param  name  dimension name
     * @param  length  fixed length, or 0 for unlimited
     */
    Dimension( String name, int length ) {
        name_ = name;
        isUnlimited_ = length == 0;
        length_ = length;
    }

    /**
     * Returns this dimension's name.
     *
     * @return  name
     */
    public String getName() {
        return name_;
    }

    /**
     * Returns the current length of this dimension.
     * For the unlimited dimension this is the number of records
     * written so far.
     *
     * @return  length
     */
    public int getLength() {
        return length_;
    }

    /**
     * Indicates whether this is the unlimited (record) dimension.
     *
     * @return  true iff unlimited
     */
    public boolean isUnlimited() {
        return isUnlimited_;
    }

    /**
     * Extends the unlimited dimension to at least a given length.
     *
     * @param  nrec  required number of records
     */
    void growTo( int nrec ) {
        assert isUnlimited_;
        length_ = Math.max( length_, nrec );
    }

    @Override
    public String toString() {
        return name_ + ( isUnlimited_ ? " = UNLIMITED" : " = " + length_ );
    }
}
