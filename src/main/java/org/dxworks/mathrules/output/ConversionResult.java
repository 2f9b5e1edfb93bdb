package org.dxworks.mathrules.output;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.dxworks.mathrules.tree.JsonTreeCodec;

import java.util.ArrayList;
import java.util.List;

/**
 * One JSON Lines record of the CLI: the conversions of one input file.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ConversionResult {
    public String kind = "result";
    public String filePath;
    public String format;
    public JsonTreeCodec.JsonNode intent;
    public String speech;
    public List<Token> speechTokens = new ArrayList<>();
    public List<BookmarkRange> bookmarks = new ArrayList<>();
    public String braille;
    public List<Token> brailleTokens;
}
