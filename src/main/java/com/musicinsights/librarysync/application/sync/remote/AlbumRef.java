package com.musicinsights.librarysync.application.sync.remote;

/**
 * 원격 카탈로그가 내려주는 앨범 참조.
 *
 * @param externalId 원격 앨범 식별자(없을 수 있음)
 * @param name       앨범명
 */
public record AlbumRef(String externalId, String name) {}
