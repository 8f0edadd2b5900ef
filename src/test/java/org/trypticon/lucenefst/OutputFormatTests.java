package org.trypticon.lucenefst;

import org.junit.Test;
import org.trypticon.lucenefst.internal.lucene.util.BytesRef;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.Matchers.sameInstance;

/**
 * Tests for {@link OutputFormat}.
 */
public class OutputFormatTests {
    @Test
    public void testForId() throws Exception {
        assertThat(OutputFormat.forId(0), is(sameInstance(OutputFormat.INTS)));
        assertThat(OutputFormat.forId(1), is(sameInstance(OutputFormat.BYTES)));
    }

    @Test(expected = UnknownFormatException.class)
    public void testForId_Unknown() throws Exception {
        OutputFormat.forId(2);
    }

    @Test
    public void testFindByName() {
        assertThat(OutputFormat.findByName("ints"), is(sameInstance(OutputFormat.INTS)));
        assertThat(OutputFormat.findByName("bytes"), is(sameInstance(OutputFormat.BYTES)));
        assertThat(OutputFormat.findByName("floats"), is(nullValue()));
    }

    @Test
    public void testInts() {
        assertThat(OutputFormat.INTS.parse("42"), is(42L));
        assertThat(OutputFormat.INTS.format(42L), is("42"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testInts_Negative() {
        OutputFormat.INTS.parse("-1");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testInts_NotNumber() {
        OutputFormat.INTS.parse("forty-two");
    }

    @Test
    public void testBytes() {
        assertThat(OutputFormat.BYTES.parse("naïve"), is(new BytesRef("naïve")));
        assertThat(OutputFormat.BYTES.format(new BytesRef("naïve")), is("naïve"));
    }
}
