package com.musicinsights.librarysync.infrastructure.persistence.r2dbc.row;

/**
 * 트랙 id와 원격 식별자만 담은 경량 조회 결과.
 *
 * @param id         트랙 식별자
 * @param externalId 원격 트랙 식별자
 */
public record TrackRef(Long id, String externalId) {}
