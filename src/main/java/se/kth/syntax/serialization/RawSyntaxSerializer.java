package se.kth.syntax.serialization;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.stream.JsonWriter;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.io.StringWriter;
import java.io.Writer;
import java.util.ArrayList;
import java.util.List;
import se.kth.syntax.exception.SerializationException;
import se.kth.syntax.raw.RawSyntax;
import se.kth.syntax.raw.RawTokenSyntax;
import se.kth.syntax.raw.SourcePresence;
import se.kth.syntax.raw.SyntaxKind;
import se.kth.syntax.raw.TokenKind;
import se.kth.syntax.util.LazyLogger;

/**
 * Writes raw trees as JSON and reads them back. A layout node is written as
 *
 * <pre>{"kind": "FUNCTION_CALL_EXPR", "presence": "PRESENT", "layout": [ ... ]}</pre>
 *
 * and a token as
 *
 * <pre>{"kind": "TOKEN", "presence": "PRESENT", "tokenKind": "IDENTIFIER", "text": "foo",
 *  "leadingTrivia": "", "trailingTrivia": " "}</pre>
 *
 * Reading does not validate shapes; use {@link se.kth.syntax.validation.SyntaxValidator} on the
 * result.
 */
public class RawSyntaxSerializer {
    private static final LazyLogger LOGGER = new LazyLogger(RawSyntaxSerializer.class);

    static final String KIND = "kind";
    static final String PRESENCE = "presence";
    static final String LAYOUT = "layout";
    static final String TOKEN_KIND = "tokenKind";
    static final String TEXT = "text";
    static final String LEADING_TRIVIA = "leadingTrivia";
    static final String TRAILING_TRIVIA = "trailingTrivia";

    private final boolean prettyPrint;

    public RawSyntaxSerializer(boolean prettyPrint) {
        this.prettyPrint = prettyPrint;
    }

    public RawSyntaxSerializer() {
        this(false);
    }

    public String serialize(RawSyntax raw) {
        StringWriter out = new StringWriter();
        try {
            write(raw, out);
        } catch (IOException e) {
            throw new IllegalStateException("StringWriter does not throw", e);
        }
        return out.toString();
    }

    public void write(RawSyntax raw, Writer out) throws IOException {
        JsonWriter writer = new JsonWriter(out);
        if (prettyPrint) {
            writer.setIndent("  ");
        }
        writeNode(raw, writer);
        writer.flush();
    }

    private void writeNode(RawSyntax raw, JsonWriter writer) throws IOException {
        writer.beginObject();
        writer.name(KIND).value(raw.getKind().name());
        writer.name(PRESENCE).value(raw.getPresence().name());
        if (raw instanceof RawTokenSyntax) {
            RawTokenSyntax token = (RawTokenSyntax) raw;
            writer.name(TOKEN_KIND).value(token.getTokenKind().name());
            writer.name(TEXT).value(token.getText());
            writer.name(LEADING_TRIVIA).value(token.getLeadingTrivia());
            writer.name(TRAILING_TRIVIA).value(token.getTrailingTrivia());
        } else {
            writer.name(LAYOUT);
            writer.beginArray();
            for (RawSyntax child : raw.getLayout()) {
                writeNode(child, writer);
            }
            writer.endArray();
        }
        writer.endObject();
    }

    public RawSyntax deserialize(String json) {
        return read(new StringReader(json));
    }

    /**
     * @throws SerializationException If the input is not a well-formed serialized tree.
     */
    public RawSyntax read(Reader in) {
        JsonElement root;
        try {
            root = JsonParser.parseReader(in);
        } catch (JsonParseException e) {
            throw new SerializationException("Malformed JSON: " + e.getMessage(), e);
        }
        RawSyntax raw = readNode(root, "$");
        LOGGER.debug(() -> "Read raw tree\n" + raw.dump());
        return raw;
    }

    private RawSyntax readNode(JsonElement element, String path) {
        if (element == null || !element.isJsonObject()) {
            throw new SerializationException("Expected an object at " + path);
        }
        JsonObject obj = element.getAsJsonObject();
        SyntaxKind kind = readEnum(SyntaxKind.class, obj, KIND, path);
        SourcePresence presence = readEnum(SourcePresence.class, obj, PRESENCE, path);

        if (kind.isToken()) {
            return RawTokenSyntax.make(
                    readEnum(TokenKind.class, obj, TOKEN_KIND, path),
                    readString(obj, TEXT, path),
                    presence,
                    readString(obj, LEADING_TRIVIA, path),
                    readString(obj, TRAILING_TRIVIA, path));
        }

        JsonElement layoutElement = obj.get(LAYOUT);
        if (layoutElement == null || !layoutElement.isJsonArray()) {
            throw new SerializationException("Expected an array '" + LAYOUT + "' at " + path);
        }
        JsonArray layoutArray = layoutElement.getAsJsonArray();
        List<RawSyntax> layout = new ArrayList<>(layoutArray.size());
        for (int i = 0; i < layoutArray.size(); i++) {
            layout.add(readNode(layoutArray.get(i), path + "." + LAYOUT + "[" + i + "]"));
        }
        return RawSyntax.make(kind, layout, presence);
    }

    private static String readString(JsonObject obj, String name, String path) {
        JsonElement element = obj.get(name);
        if (element == null || !element.isJsonPrimitive() || !element.getAsJsonPrimitive().isString()) {
            throw new SerializationException("Expected a string '" + name + "' at " + path);
        }
        return element.getAsString();
    }

    private static <E extends Enum<E>> E readEnum(
            Class<E> enumType, JsonObject obj, String name, String path) {
        String value = readString(obj, name, path);
        try {
            return Enum.valueOf(enumType, value);
        } catch (IllegalArgumentException e) {
            throw new SerializationException(
                    "Unknown " + enumType.getSimpleName() + " '" + value + "' at " + path, e);
        }
    }
}
