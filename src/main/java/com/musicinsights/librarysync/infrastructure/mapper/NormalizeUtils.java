package com.musicinsights.librarysync.infrastructure.mapper;

import java.text.Normalizer;
import java.util.Locale;

/**
 * 원격 레코드를 store 자연키로 바꿀 때 쓰는 "정규화/키 생성" 유틸리티입니다.
 * <p>
 * - 문자열 정규화(trim, 빈 값 처리)
 * - 비교용 단순화(대소문자/결합문자/공백/기호 제거)
 * - 아티스트/앨범 자연키 생성
 * <p>
 * 원격 식별자가 있으면 {@code ext:} 키를, 없으면 이름 기반 {@code name:} 키를 사용합니다.
 */
public final class NormalizeUtils {

    /** 앨범 정보가 없는 트랙이 모이는 placeholder 앨범의 키 */
    public static final String UNKNOWN_ALBUM_KEY = "unknown";

    /** placeholder 앨범 표시명 */
    public static final String UNKNOWN_ALBUM_NAME = "Unknown Album";

    private NormalizeUtils() {}

    /**
     * 문자열을 정규화합니다.
     * <p>
     * trim 후 빈 문자열이면 null을 반환합니다.
     *
     * @param s 원본 문자열
     * @return 정규화된 문자열 또는 null
     */
    public static String norm(String s) {
        if (s == null) return null;
        String t = s.trim();
        return t.isEmpty() ? null : t;
    }

    /** 비교용 문자열 정규화 */
    static String simplify(String input) {
        if (input == null) return null;

        String result = Normalizer.normalize(input, Normalizer.Form.NFKC);

        // 소문자화 후 NFD로 분해 → 결합문자 제거
        result = Normalizer.normalize(result.toLowerCase(Locale.ROOT), Normalizer.Form.NFD)
                .replaceAll("\\p{M}", "");

        // NFD로 인해 분해된 한글 자모를 다시 완성형으로 합치기
        result = Normalizer.normalize(result, Normalizer.Form.NFC);

        return result
                .replaceAll("[\\s\\p{Z}]", "")
                .replaceAll("[^a-z0-9\\p{IsHangul}]", "");
    }

    /**
     * 이름 기반 키 조각을 만듭니다.
     * <p>
     * 단순화 결과가 비어 있으면(기호/이모지만 있는 이름) 소문자 원문을 사용합니다.
     */
    private static String nameKey(String name) {
        String n = norm(name);
        if (n == null) return null;
        String s = simplify(n);
        return s.isEmpty() ? n.toLowerCase(Locale.ROOT) : s;
    }

    /**
     * Artist 자연키.
     *
     * @param externalId 원격 아티스트 id(nullable)
     * @param name       아티스트 이름(nullable)
     * @return 자연키, 둘 다 비어 있으면 null
     */
    public static String artistKey(String externalId, String name) {
        String ext = norm(externalId);
        if (ext != null) return "ext:" + ext;
        String nk = nameKey(name);
        return nk == null ? null : "name:" + nk;
    }

    /**
     * Album 자연키.
     * <p>
     * 원격 id가 없으면 앨범명과 대표 아티스트 키를 묶어 동명 앨범을 구분합니다.
     *
     * @param externalId       원격 앨범 id(nullable)
     * @param name             앨범명(nullable)
     * @param primaryArtistKey 대표 아티스트 키(nullable)
     * @return 자연키, id와 이름이 모두 비어 있으면 null
     */
    public static String albumKey(String externalId, String name, String primaryArtistKey) {
        String ext = norm(externalId);
        if (ext != null) return "ext:" + ext;
        String nk = nameKey(name);
        if (nk == null) return null;
        return "name:" + nk + "|" + (primaryArtistKey == null ? "" : primaryArtistKey);
    }
}
