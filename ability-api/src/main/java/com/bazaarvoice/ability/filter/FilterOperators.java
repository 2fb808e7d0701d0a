package com.bazaarvoice.ability.filter;

/**
 * Vocabulary of the document filter format produced by {@link DocumentFilterCompiler}.
 * <p>
 * A filter document maps dotted field paths to clauses.  A clause is either an object of operators, all of which
 * must hold, or a literal value meaning {@code $eq}.  All clauses of a document must hold.
 */
public abstract class FilterOperators {

    /** Every stored document has a string identifier under this field. */
    public static final String ID_FIELD = "_id";

    public static final String EQ = "$eq";
    public static final String IN = "$in";
    public static final String GT = "$gt";
    public static final String GTE = "$gte";
    public static final String LT = "$lt";
    public static final String LTE = "$lte";
    public static final String EXISTS = "$exists";
    public static final String TYPE = "$type";
    /** The field value, or when it is a list any one of its elements, satisfies the nested filter document. */
    public static final String MATCH = "$match";

    public static final String TYPE_NULL = "null";
    public static final String TYPE_BOOL = "bool";
    public static final String TYPE_NUM = "num";
    public static final String TYPE_STRING = "string";
    public static final String TYPE_ARRAY = "array";
    public static final String TYPE_OBJECT = "object";
}
