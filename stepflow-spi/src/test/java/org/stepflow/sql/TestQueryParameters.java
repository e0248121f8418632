package org.stepflow.sql;

import com.google.common.collect.ImmutableList;
import org.testng.annotations.Test;

import static org.stepflow.collection.FieldType.ARRAY_STRING;
import static org.stepflow.collection.FieldType.STRING;
import static org.testng.Assert.assertEquals;
import static org.testng.Assert.expectThrows;

public class TestQueryParameters {
    @Test
    public void testBindReturnsName() {
        QueryParameters parameters = new QueryParameters();

        assertEquals(parameters.bind("f0_country_in", ARRAY_STRING, ImmutableList.of("DE", "FR")), "f0_country_in");
        assertEquals(parameters.get("f0_country_in"), new NamedParameterValue(ARRAY_STRING, ImmutableList.of("DE", "FR")));
    }

    @Test
    public void testRebindingSameValueIsAllowed() {
        QueryParameters parameters = new QueryParameters();
        parameters.bind("page_view_event", STRING, "screen_view");
        parameters.bind("page_view_event", STRING, "screen_view");

        assertEquals(parameters.asMap().size(), 1);
    }

    @Test
    public void testConflictingValueRejected() {
        QueryParameters parameters = new QueryParameters();
        parameters.bind("scope", STRING, "site-1");

        expectThrows(IllegalArgumentException.class, () -> parameters.bind("scope", STRING, "site-2"));
    }

    @Test
    public void testNamesMustBeIdentifiers() {
        expectThrows(IllegalArgumentException.class, () -> new QueryParameters().bind("x; DROP TABLE", STRING, "a"));
    }

    @Test
    public void testFrozenParametersRejectBindings() {
        QueryParameters parameters = new QueryParameters().freeze();

        expectThrows(IllegalStateException.class, () -> parameters.bind("scope", STRING, "site-1"));
    }
}
