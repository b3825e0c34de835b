package com.logscale.query;

import com.logscale.config.Constants;

import java.util.Set;

/**
 * 查询函数名保留字表。
 *
 * <p>保留字在自由文本位置必须加引号或以函数调用形式出现；作为字段名（如 {@code test=fisk}）不受限制。
 * 匹配区分大小写。表内容变化时同步递增 {@link Constants#RESERVED_WORDS_VERSION}。</p>
 */
public final class ReservedWords {
    private ReservedWords() {
        // 工具类，禁止实例化
    }

    private static final Set<String> WORDS = Set.of(
        // 通用与聚合
        "asn", "avg", "base64Decode", "base64Encode", "bucket", "callFunction", "cidr", "coalesce",
        "collect", "communityId", "concat", "concatArray", "copyEvent", "count", "counterAsRate",
        "createEvents", "default", "defineTable", "drop", "dropEvent", "duration", "end", "eval",
        "eventFieldCount", "eventInternals", "eventSize", "fieldset", "fieldstats", "findTimestamp",
        "format", "formatDuration", "formatTime", "geohash", "getField", "groupBy", "hash", "hashMatch",
        "hashRewrite", "head", "in", "ipLocation", "join", "kvParse", "length", "linReg", "lookup",
        "lower", "lowercase", "match", "max", "min", "neighbor", "now", "parseCEF", "parseCsv",
        "parseFixedWidth", "parseHexString", "parseInt", "parseJson", "parseLEEF", "parseTimestamp",
        "parseUri", "parseUrl", "parseXml", "percentage", "percentile", "range", "rdns", "readFile",
        "regex", "rename", "replace", "round", "sample", "sankey", "select", "selectFromMax",
        "selectFromMin", "selectLast", "series", "session", "setField", "setTimeInterval",
        "shannonEntropy", "sort", "split", "splitString", "start", "stats", "stdDev", "stripAnsiCodes",
        "subnet", "sum", "table", "tail", "test", "timeChart", "tokenHash", "top", "transpose",
        "upper", "urlDecode", "urlEncode", "wildcard", "window", "worldMap",
        // array:
        "array:append", "array:contains", "array:dedup", "array:drop", "array:eval", "array:exists",
        "array:filter", "array:intersection", "array:length", "array:reduceAll", "array:reduceColumn",
        "array:reduceRow", "array:regex", "array:rename", "array:sort", "array:union",
        "objectArray:eval", "objectArray:exists",
        // math:
        "math:abs", "math:arccos", "math:arcsin", "math:arctan", "math:arctan2", "math:ceil", "math:cos",
        "math:cosh", "math:deg2rad", "math:exp", "math:expm1", "math:floor", "math:log", "math:log10",
        "math:log1p", "math:log2", "math:mod", "math:pow", "math:rad2deg", "math:sin", "math:sinh",
        "math:spherical2cartesian", "math:sqrt", "math:tan", "math:tanh",
        // time:
        "time:dayOfMonth", "time:dayOfWeek", "time:dayOfWeekName", "time:dayOfYear", "time:hour",
        "time:millisecond", "time:minute", "time:month", "time:monthName", "time:second",
        "time:weekOfYear", "time:year",
        // 其他命名空间
        "text:contains", "text:endsWith", "text:length", "text:startsWith", "text:substring",
        "crypto:md5", "crypto:sha1", "crypto:sha256", "geography:distance", "ioc:lookup",
        "json:prettyPrint", "xml:prettyPrint", "unit:convert", "bitfield:extractFlags",
        "beta:param", "event:eventSize"
    );

    public static boolean isReserved(String word) {
        return word != null && WORDS.contains(word);
    }

    public static Set<String> all() {
        return WORDS;
    }

    public static int version() {
        return Constants.RESERVED_WORDS_VERSION;
    }
}
