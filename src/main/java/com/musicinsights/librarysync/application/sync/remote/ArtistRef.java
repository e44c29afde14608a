package com.musicinsights.librarysync.application.sync.remote;

/**
 * 원격 카탈로그가 내려주는 아티스트 참조.
 *
 * @param externalId 원격 아티스트 식별자(없을 수 있음)
 * @param name       아티스트 이름
 */
public record ArtistRef(String externalId, String name) {}
