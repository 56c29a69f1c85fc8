package com.assettrack.setracker.protocol;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Closed set of command tokens understood by the gateway. Tokens are matched
 * exactly and case-sensitively; anything else resolves to {@link #UNKNOWN}.
 */
public enum CommandType {

    // Device notifications
    LK("LK", Category.HEARTBEAT, "0002"),
    AL("AL", Category.ALARM, "0002"),
    UD("UD", Category.POSITION, null),
    UD2("UD2", Category.POSITION, null),
    PP("PP", Category.POSITION, null),
    CONFIG("CONFIG", Category.CONFIG, "0006"),
    IMG("img", Category.IMAGE, null),

    // Acknowledgements of server commands
    APN("APN", Category.SERVER_COMMAND, "0004"),
    UPLOAD("UPLOAD", Category.SERVER_COMMAND, "0006"),
    PW("PW", Category.SERVER_COMMAND, "0006"),
    CALL("CALL", Category.SERVER_COMMAND, "0004"),
    CENTER("CENTER", Category.SERVER_COMMAND, "0004"),
    MONITOR("MONITOR", Category.SERVER_COMMAND, "0004"),
    SOS1("SOS1", Category.SERVER_COMMAND, "0004"),
    SOS2("SOS2", Category.SERVER_COMMAND, "0004"),
    SOS3("SOS3", Category.SERVER_COMMAND, "0004"),
    SOS("SOS", Category.SERVER_COMMAND, "0006"),
    IP("IP", Category.SERVER_COMMAND, "0008"),
    FACTORY("FACTORY", Category.SERVER_COMMAND, "0006"),
    LZ("LZ", Category.SERVER_COMMAND, "0006"),
    SOSSMS("SOSSMS", Category.SERVER_COMMAND, "0006"),
    LOWBAT("LOWBAT", Category.SERVER_COMMAND, "0006"),
    VERNO("VERNO", Category.SERVER_COMMAND, "0006"),
    TS("TS", Category.SERVER_COMMAND, "0006"),
    RESET("RESET", Category.SERVER_COMMAND, "0006"),
    CR("CR", Category.SERVER_COMMAND, "0006"),
    POWEROFF("POWEROFF", Category.SERVER_COMMAND, "0006"),
    REMOVE("REMOVE", Category.SERVER_COMMAND, "0006"),
    REMOVESMS("REMOVESMS", Category.SERVER_COMMAND, "0006"),
    WALKTIME("WALKTIME", Category.SERVER_COMMAND, "0006"),
    SLEEPTIME("SLEEPTIME", Category.SERVER_COMMAND, "0006"),
    SILENCETIME("SILENCETIME", Category.SERVER_COMMAND, "0006"),
    SILENCETIME2("SILENCETIME2", Category.SERVER_COMMAND, "0006"),
    FIND("FIND", Category.SERVER_COMMAND, "0006"),
    FLOWER("FLOWER", Category.SERVER_COMMAND, "0006"),
    REMIND("REMIND", Category.SERVER_COMMAND, "0006"),
    TK("TK", Category.SERVER_COMMAND, "0006"),
    TKQ("TKQ", Category.SERVER_COMMAND, "0006"),
    TKQ2("TKQ2", Category.SERVER_COMMAND, "0006"),
    MESSAGE("MESSAGE", Category.SERVER_COMMAND, "0006"),
    PHB("PHB", Category.SERVER_COMMAND, "0006"),
    PHB2("PHB2", Category.SERVER_COMMAND, "0006"),
    PHBX("PHBX", Category.SERVER_COMMAND, "0006"),
    PHBX2("PHBX2", Category.SERVER_COMMAND, "0006"),
    DPHBX("DPHBX", Category.SERVER_COMMAND, "0006"),
    PPR("PPR", Category.SERVER_COMMAND, "0006"),
    PROFILE("profile", Category.SERVER_COMMAND, "0006"),
    WHITELIST1("WHITELIST1", Category.SERVER_COMMAND, "0006"),
    WHITELIST2("WHITELIST2", Category.SERVER_COMMAND, "0006"),
    HRTSTART("hrtstart", Category.SERVER_COMMAND, "0006"),
    HEALTHAUTOSET("HEALTHAUTOSET", Category.SERVER_COMMAND, "0006"),
    BPHRT("bphrt", Category.SERVER_COMMAND, "0006"),
    OXYGEN("oxygen", Category.SERVER_COMMAND, "0006"),
    TAKEPILLS("TAKEPILLS", Category.SERVER_COMMAND, "0006"),
    RCAPTURE("rcapture", Category.SERVER_COMMAND, "0006"),
    FALLDOWN("FALLDOWN", Category.SERVER_COMMAND, "0006"),
    LSSET("LSSET", Category.SERVER_COMMAND, "0006"),
    BODYTEMP("bodytemp", Category.SERVER_COMMAND, "0006"),
    BODYTEMP2("bodytemp2", Category.SERVER_COMMAND, "0006"),
    BTEMP2("btemp2", Category.SERVER_COMMAND, "0006"),
    WIFISEARCH("WIFISEARCH", Category.SERVER_COMMAND, "0006"),
    WIFISET("WIFISET", Category.SERVER_COMMAND, "0006"),
    WIFIDEL("WIFIDEL", Category.SERVER_COMMAND, "0006"),
    WIFICUR("WIFICUR", Category.SERVER_COMMAND, "0006"),
    WIFIINFOUP("WIFIINFOUP", Category.SERVER_COMMAND, "0006"),
    APPLOCK("APPLOCK", Category.SERVER_COMMAND, "0006"),
    DEVREFUSEPHONESWITCH("DEVREFUSEPHONESWITCH", Category.SERVER_COMMAND, "0006"),
    ACALL("ACALL", Category.SERVER_COMMAND, "0006"),

    UNKNOWN("", Category.UNKNOWN, null);

    /**
     * How the dispatcher treats a command.
     */
    public enum Category {
        HEARTBEAT,
        ALARM,
        POSITION,
        CONFIG,
        IMAGE,
        SERVER_COMMAND,
        UNKNOWN
    }

    public static final String DEFAULT_REPLY_LENGTH = "0002";

    private static final Map<String, CommandType> BY_TOKEN;

    static {
        Map<String, CommandType> tokens = new HashMap<>();
        for (CommandType type : values()) {
            if (type != UNKNOWN) {
                tokens.put(type.token, type);
            }
        }
        BY_TOKEN = Collections.unmodifiableMap(tokens);
    }

    private final String token;
    private final Category category;
    private final String replyLength;

    CommandType(String token, Category category, String replyLength) {
        this.token = token;
        this.category = category;
        this.replyLength = replyLength;
    }

    public String getToken() {
        return token;
    }

    public Category getCategory() {
        return category;
    }

    /**
     * Fixed length field used in the reply to this command, {@code "0002"} when the table has no entry.
     */
    public String getReplyLength() {
        return replyLength != null ? replyLength : DEFAULT_REPLY_LENGTH;
    }

    public static CommandType fromToken(String token) {
        if (token == null) {
            return UNKNOWN;
        }
        return BY_TOKEN.getOrDefault(token, UNKNOWN);
    }

    public static String replyLengthFor(String token) {
        return fromToken(token).getReplyLength();
    }
}
