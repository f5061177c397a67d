package com.questrail.spex.table.fits;

import com.questrail.spex.table.Header;
import nom.tam.fits.FitsException;
import nom.tam.fits.HeaderCard;
import nom.tam.util.Cursor;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * FitsHeaderCodec
 * -----------------------------------------------------------------------------
 * Copies keyword values between {@link Header} and nom.tam FITS headers.
 *
 * <p>nom.tam hands out card values as text. Quoted values stay strings,
 * {@code T}/{@code F} become logicals and numeric text becomes a long or a
 * double. Keywords that describe the layout of an HDU are never copied
 * into a FITS header, since nom.tam owns them.</p>
 */
final class FitsHeaderCodec
{
    /**
     * Keywords written by nom.tam from the HDU layout.
     */
    static final Pattern STRUCTURAL = Pattern.compile(
            "SIMPLE|EXTEND|XTENSION|BITPIX|NAXIS\\d*|PCOUNT|GCOUNT|TFIELDS|THEAP|EXTNAME"
                    + "|T(TYPE|FORM|UNIT|DIM|NULL|SCAL|ZERO|DISP)\\d+");

    private static final Pattern INTEGER = Pattern.compile("[+-]?\\d+");
    private static final int MAX_TEXT = 70;

    private FitsHeaderCodec() {}

    /**
     * Decodes every keyword card of {@code source}, skipping those matched
     * by {@code skip} (which may be {@code null}).
     */
    static Header decode(nom.tam.fits.Header source, Pattern skip) {
        Header.Builder header = Header.builder();
        Cursor<String, HeaderCard> cards = source.iterator();
        while (cards.hasNext()) {
            HeaderCard card = cards.next();
            String key = card.getKey();
            if (key == null || key.isBlank() || key.equals("END")) {
                continue;
            }
            if (key.equals("HISTORY")) {
                header.addHistory(text(card.getComment()));
                continue;
            }
            if (key.equals("COMMENT")) {
                header.addComment(text(card.getComment()));
                continue;
            }
            if (!card.isKeyValuePair() || (skip != null && skip.matcher(key).matches())) {
                continue;
            }
            String raw = card.getValue();
            if (card.isStringValue()) {
                header.put(key, raw == null ? "" : raw.strip());
            } else if (raw != null && !raw.isBlank()) {
                header.putValue(key, parseValue(raw.strip()));
            }
        }
        return header.build();
    }

    /**
     * Adds the keyword values, history and comments of {@code header} to
     * {@code target}. Structural keywords are left to nom.tam.
     */
    static void encode(Header header, nom.tam.fits.Header target) throws FitsException {
        for (String key : header.keys()) {
            if (STRUCTURAL.matcher(key).matches()) {
                continue;
            }
            Object value = header.get(key).orElseThrow();
            if (value instanceof Boolean b) {
                target.addValue(key, b.booleanValue(), null);
            } else if (value instanceof Long l) {
                target.addValue(key, l.longValue(), null);
            } else if (value instanceof Double d) {
                target.addValue(key, d.doubleValue(), null);
            } else {
                target.addValue(key, String.valueOf(value), null);
            }
        }
        for (String line : header.history()) {
            for (String chunk : chunks(line)) {
                target.insertHistory(chunk);
            }
        }
        for (String line : header.comments()) {
            for (String chunk : chunks(line)) {
                target.insertComment(chunk);
            }
        }
    }

    static Object parseValue(String raw) {
        if (raw.equals("T")) {
            return Boolean.TRUE;
        }
        if (raw.equals("F")) {
            return Boolean.FALSE;
        }
        if (INTEGER.matcher(raw).matches()) {
            try {
                return Long.parseLong(raw);
            } catch (NumberFormatException ex) {
                return Double.parseDouble(raw);
            }
        }
        try {
            return Double.parseDouble(raw.replace('D', 'E').replace('d', 'e'));
        } catch (NumberFormatException ex) {
            return raw;
        }
    }

    /**
     * Splits {@code line} into pieces that fit a commentary card.
     */
    static List<String> chunks(String line) {
        List<String> out = new ArrayList<>();
        if (line.length() <= MAX_TEXT) {
            out.add(line);
            return out;
        }
        for (int i = 0; i < line.length(); i += MAX_TEXT) {
            out.add(line.substring(i, Math.min(line.length(), i + MAX_TEXT)));
        }
        return out;
    }

    private static String text(String comment) {
        return comment == null ? "" : comment.strip();
    }
}
