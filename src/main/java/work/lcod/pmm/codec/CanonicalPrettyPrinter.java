package work.lcod.pmm.codec;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import java.io.IOException;

/**
 * Four-space indentation, {@code "key": value} separators, {@code \n} line ends and no padding
 * inside empty containers ({@code {}}, {@code []}).
 */
final class CanonicalPrettyPrinter extends DefaultPrettyPrinter {
    private static final DefaultIndenter INDENTER = new DefaultIndenter("    ", "\n");

    CanonicalPrettyPrinter() {
        indentObjectsWith(INDENTER);
        indentArraysWith(INDENTER);
    }

    private CanonicalPrettyPrinter(CanonicalPrettyPrinter base) {
        super(base);
    }

    @Override
    public DefaultPrettyPrinter createInstance() {
        return new CanonicalPrettyPrinter(this);
    }

    @Override
    public void writeObjectFieldValueSeparator(JsonGenerator g) throws IOException {
        g.writeRaw(": ");
    }

    @Override
    public void writeEndObject(JsonGenerator g, int nrOfEntries) throws IOException {
        if (!_objectIndenter.isInline()) {
            --_nesting;
        }
        if (nrOfEntries > 0) {
            _objectIndenter.writeIndentation(g, _nesting);
        }
        g.writeRaw('}');
    }

    @Override
    public void writeEndArray(JsonGenerator g, int nrOfValues) throws IOException {
        if (!_arrayIndenter.isInline()) {
            --_nesting;
        }
        if (nrOfValues > 0) {
            _arrayIndenter.writeIndentation(g, _nesting);
        }
        g.writeRaw(']');
    }
}
