package com.jumbo.companion.service.template;

import com.jumbo.companion.model.ResponseTemplate;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.Random;
import java.util.zip.CRC32;

/**
 * Picks a variation reproducibly from the user id and turn index.
 */
@Component
public class VariationPicker {

    public int pick(ResponseTemplate template, String userId, int turnIndex) {
        int size = template.variations().size();
        if (size <= 1) {
            return 0;
        }
        return new Random(seed(userId, turnIndex)).nextInt(size);
    }

    static long seed(String userId, int turnIndex) {
        CRC32 crc = new CRC32();
        crc.update((userId == null ? "" : userId).getBytes(StandardCharsets.UTF_8));
        return crc.getValue() * 31 + turnIndex;
    }
}
