package com.RK8.FieldReport.Parser;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * Turns uploaded bytes into text. CRM exports are UTF-8 except for the older
 * activity export, which is Windows-1252.
 */
@Slf4j
@Component
public class ExtractDecoder {
    private static final Charset WINDOWS_1252 = Charset.forName("windows-1252");
    private static final char BOM = '\uFEFF';

    public String decode(byte[] bytes) {
        if (bytes == null || bytes.length == 0) return "";

        String text;
        try {
            text = StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
        } catch (CharacterCodingException e) {
            log.info("Extract is not valid UTF-8, decoding as windows-1252");
            text = new String(bytes, WINDOWS_1252);
        }

        if (!text.isEmpty() && text.charAt(0) == BOM) {
            text = text.substring(1);
        }
        return text;
    }
}
