package com.sblite.messaging.amqp;

import org.apache.qpid.proton.amqp.Symbol;
import org.apache.qpid.proton.amqp.UnknownDescribedType;
import org.apache.qpid.proton.amqp.messaging.Source;

import java.util.HashMap;
import java.util.Map;

/**
 * Builds source termini carrying a filter set.
 *
 * The offset filter is a selector filter: a described string whose descriptor
 * is the same symbol used as its key in the filter set.
 */
final class SourceFilters {

    static final Symbol SELECTOR_FILTER = Symbol.valueOf("apache.org:selector-filter:string");

    static final String OFFSET_ANNOTATION = "amqp.annotation.x-opt-offset";

    private SourceFilters() {
    }

    /**
     * Source for the address selecting only messages positioned strictly after the offset.
     */
    static Source afterOffset(String address, String offset) {
        Map<Symbol, Object> filter = new HashMap<>();
        filter.put(SELECTOR_FILTER, new UnknownDescribedType(SELECTOR_FILTER, offsetExpression(offset)));

        Source source = new Source();
        source.setAddress(address);
        source.setFilter(filter);
        return source;
    }

    static String offsetExpression(String offset) {
        return OFFSET_ANNOTATION + " > '" + offset + "'";
    }
}
