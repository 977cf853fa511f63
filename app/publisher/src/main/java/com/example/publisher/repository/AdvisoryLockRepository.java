/*
 * どこで: Publisher データアクセス
 * 何を: PostgreSQL の transaction-level advisory lock を取得する
 * なぜ: 複数インスタンス間でトークン更新/メディア再ホスト/アカウント作成を直列化するため
 */
package com.example.publisher.repository;

import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

@Repository
@RequiredArgsConstructor
public class AdvisoryLockRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  @Transactional(propagation = Propagation.MANDATORY)
  public void lock(long lockKey) {
    // ロックはトランザクション終了時に自動で解放される
    final String sql = "SELECT pg_advisory_xact_lock(:lockKey)";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("lockKey", lockKey);
    jdbcTemplate.query(sql, params, rs -> null);
  }
}
