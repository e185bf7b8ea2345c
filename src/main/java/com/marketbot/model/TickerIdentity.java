package com.marketbot.model;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 模块说明：TickerIdentity（class）。
 * 主要职责：统一处理韩国股票代码的多种写法（裸代码、.KS、.KQ），供下载与文件定位共用。
 * 使用建议：所有别名规则只在此处维护，调用方不要自行拼接后缀。
 */
public final class TickerIdentity {
    public static final String SUFFIX_KOSPI = ".KS";
    public static final String SUFFIX_KOSDAQ = ".KQ";

    private static final Pattern KR_SUFFIXED = Pattern.compile("^(\\d{6})\\.(KS|KQ)$", Pattern.CASE_INSENSITIVE);
    private static final Pattern SIX_DIGITS = Pattern.compile("(\\d{6})");

    public final String raw;
    public final String code;
    public final String suffix;

    private TickerIdentity(String raw, String code, String suffix) {
        this.raw = raw;
        this.code = code;
        this.suffix = suffix;
    }

    public static TickerIdentity parse(String input) {
        String raw = input == null ? "" : input.trim();
        if (raw.isEmpty()) {
            throw new IllegalArgumentException("ticker must not be blank");
        }
        Matcher suffixed = KR_SUFFIXED.matcher(raw);
        if (suffixed.matches()) {
            return new TickerIdentity(raw, suffixed.group(1), "." + suffixed.group(2).toUpperCase(Locale.ROOT));
        }
        if (raw.chars().allMatch(Character::isDigit)) {
            Matcher digits = SIX_DIGITS.matcher(raw);
            String code = digits.find() ? digits.group(1) : null;
            return new TickerIdentity(raw, code, "");
        }
        return new TickerIdentity(raw, null, "");
    }

    public boolean hasKoreanCode() {
        return code != null;
    }

    /**
     * Korean when the ticker carries an exchange suffix, is purely numeric, or the market says so.
     */
    public boolean isKorean(Market market) {
        if (market != null && market.isKorean()) {
            return true;
        }
        return !suffix.isEmpty() || (!raw.isEmpty() && raw.chars().allMatch(Character::isDigit));
    }

    /**
     * Bare 6-digit code for providers that take it unsuffixed; the raw ticker otherwise.
     */
    public String providerCode() {
        return code == null ? raw : code;
    }

    /**
     * Exchange-suffixed symbols in priority order: KOSDAQ tries .KQ first, KOSPI tries .KS first.
     */
    public List<String> exchangeCandidates(Market market) {
        if (code == null || market == null || !market.isKorean()) {
            return List.of(raw);
        }
        List<String> out = new ArrayList<>(2);
        if (market == Market.KOSDAQ) {
            out.add(code + SUFFIX_KOSDAQ);
            out.add(code + SUFFIX_KOSPI);
        } else {
            out.add(code + SUFFIX_KOSPI);
            out.add(code + SUFFIX_KOSDAQ);
        }
        return out;
    }

    /**
     * File-name prefixes under which this ticker may have been stored, first seen wins.
     */
    public List<String> storageCandidates(Market market) {
        Set<String> ordered = new LinkedHashSet<>();
        ordered.add(raw);
        if (code != null && market != null && market.isKorean()) {
            ordered.add(code);
            ordered.addAll(exchangeCandidates(market));
        }
        return new ArrayList<>(ordered);
    }

    @Override
    public String toString() {
        return raw;
    }
}
