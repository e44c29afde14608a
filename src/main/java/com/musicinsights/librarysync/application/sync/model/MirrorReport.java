package com.musicinsights.librarysync.application.sync.model;

/**
 * 미러 플레이리스트 갱신 결과.
 *
 * @param added          이번 실행에서 원격에 추가한 트랙 수
 * @param alreadyPresent 실행 전에 이미 미러에 있던 트랙 수
 * @param remoteCreated  원격 미러 플레이리스트를 새로 만들었는지 여부
 * @param remoteId       미러 플레이리스트의 원격 id
 */
public record MirrorReport(long added, long alreadyPresent, boolean remoteCreated, String remoteId) {}
