package com.example.resourceapi.scroll;

import com.example.resourceapi.common.exception.ValidationException;
import com.example.resourceapi.common.util.StringSanitizer;
import org.bson.types.ObjectId;

import java.util.Locale;

/**
 * Opaque resumption token for infinite scroll. The token is the identifier of the last item of the
 * previous page in its canonical external form; decoding checks well-formedness only.
 */
public final class CursorCodec {

    private CursorCodec() {}

    public static String encode(String id) {
        return id == null ? null : id.toLowerCase(Locale.ROOT);
    }

    /**
     * @throws ValidationException when the token is not a well-formed identifier
     */
    public static String decode(String token) {
        if (token == null || !ObjectId.isValid(token.trim())) {
            throw new ValidationException(
                    "Invalid after_id cursor '" + StringSanitizer.forLog(token) + "'");
        }
        return token.trim().toLowerCase(Locale.ROOT);
    }
}
