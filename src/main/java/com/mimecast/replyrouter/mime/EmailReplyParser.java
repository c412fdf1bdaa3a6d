package com.mimecast.replyrouter.mime;

import com.mimecast.replyrouter.domain.ParsedMessage;
import com.mimecast.replyrouter.service.ReplyParser;
import org.apache.commons.lang3.StringUtils;

import java.util.regex.Pattern;

/**
 * Reply parser keeping only the text above the quoted history.
 *
 * <p>The body is cut at the first of:
 * <ul>
 *     <li>A quoted line starting with {@code >}</li>
 *     <li>A quote header such as {@code On Mon, 1 Jan 2024, Jane <jane@example.com> wrote:},
 *     also when wrapped over two lines</li>
 *     <li>An Outlook separator such as {@code -----Original Message-----} or a line of underscores</li>
 *     <li>A signature delimiter {@code -- }</li>
 * </ul>
 * The remainder is trimmed.
 */
public class EmailReplyParser implements ReplyParser {

    private static final Pattern QUOTE_HEADER = Pattern.compile("^On\\s.+wrote:$", Pattern.CASE_INSENSITIVE);
    private static final Pattern ORIGINAL_MESSAGE = Pattern.compile("^-{3,}\\s*Original Message\\s*-{3,}$",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern UNDERSCORES = Pattern.compile("^_{20,}$");
    private static final Pattern SIGNATURE = Pattern.compile("^--\\s?$");

    /**
     * Date, comma or address as found in quote attributions.
     */
    private static final Pattern ATTRIBUTION_HINT = Pattern.compile("\\d|,|<[^<>@\\s]+@[^<>\\s]+>");

    @Override
    public String extractReply(ParsedMessage message) {
        String body = message.getBody();
        if (StringUtils.isBlank(body)) {
            return "";
        }

        String[] lines = body.replace("\r\n", "\n").replace('\r', '\n').split("\n", -1);
        StringBuilder reply = new StringBuilder();

        for (int i = 0; i < lines.length; i++) {
            if (isCutLine(lines, i)) {
                break;
            }
            reply.append(lines[i]).append('\n');
        }

        return reply.toString().trim();
    }

    /**
     * Is this line where the quoted history starts.
     *
     * @param lines Body lines.
     * @param i     Line index.
     * @return Boolean.
     */
    private static boolean isCutLine(String[] lines, int i) {
        String line = lines[i];
        String trimmed = line.trim();

        if (trimmed.startsWith(">")) {
            return true;
        }

        if (SIGNATURE.matcher(line).matches()) {
            return true;
        }

        if (ORIGINAL_MESSAGE.matcher(trimmed).matches() || UNDERSCORES.matcher(trimmed).matches()) {
            return true;
        }

        if (QUOTE_HEADER.matcher(trimmed).matches()) {
            return true;
        }

        return isWrappedQuoteHeader(lines, i);
    }

    /**
     * Clients wrap long quote headers over two lines.
     * <p>The first line must read like an attribution and the pair must end the block,
     * <br>so a reply whose own lines start with "On" and end with "wrote:" is kept.
     *
     * @param lines Body lines.
     * @param i     Index of the first line.
     * @return Boolean.
     */
    private static boolean isWrappedQuoteHeader(String[] lines, int i) {
        if (i + 1 >= lines.length) {
            return false;
        }

        String first = lines[i].trim();
        if (!first.regionMatches(true, 0, "On ", 0, 3) || !ATTRIBUTION_HINT.matcher(first).find()) {
            return false;
        }

        if (!QUOTE_HEADER.matcher(first + " " + lines[i + 1].trim()).matches()) {
            return false;
        }

        String after = i + 2 < lines.length ? lines[i + 2].trim() : "";
        return after.isEmpty() || after.startsWith(">");
    }
}
