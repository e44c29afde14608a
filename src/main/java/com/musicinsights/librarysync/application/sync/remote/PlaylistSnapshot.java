package com.musicinsights.librarysync.application.sync.remote;

/**
 * 원격 플레이리스트 헤더.
 *
 * @param remoteId 원격 플레이리스트 식별자
 * @param title    제목
 */
public record PlaylistSnapshot(String remoteId, String title) {}
