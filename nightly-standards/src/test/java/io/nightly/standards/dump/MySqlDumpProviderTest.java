package io.nightly.standards.dump;

import java.sql.Connection;
import org.junit.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.mockito.Mockito.mock;

public class MySqlDumpProviderTest
{
    private final MySqlDumpProvider provider = new MySqlDumpProvider(mock(Connection.class));

    @Test
    public void escapesLikeRealEscapeString()
    {
        assertThat(provider.escapeValue("plain"), is("'plain'"));
        assertThat(provider.escapeValue("it's"), is("'it\\'s'"));
        assertThat(provider.escapeValue("say \"hi\""), is("'say \\\"hi\\\"'"));
        assertThat(provider.escapeValue("a\\b"), is("'a\\\\b'"));
        assertThat(provider.escapeValue("line1\nline2\r"), is("'line1\\nline2\\r'"));
        assertThat(provider.escapeValue("nul\0sub\u001a"), is("'nul\\0sub\\Z'"));
    }

    @Test
    public void rendersNullAndBinary()
    {
        assertThat(provider.escapeValue(null), is("NULL"));
        assertThat(provider.escapeValue(new byte[] {0x00, 0x7f}), is("X'007f'"));
        assertThat(provider.escapeValue(42), is("'42'"));
    }

    @Test
    public void quotesIdentifiersWithBackticks()
    {
        assertThat(provider.escapeIdent("wp_posts"), is("`wp_posts`"));
        assertThat(provider.escapeIdent("odd`name"), is("`odd``name`"));
    }
}
