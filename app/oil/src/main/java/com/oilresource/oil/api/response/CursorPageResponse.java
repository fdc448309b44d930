/*
 * どこで: Oil API レスポンス DTO
 * 何を: カーソル方式の一覧レスポンス
 * なぜ: 件数の多い一覧でも OFFSET を使わずに次ページへ進めるため
 */
package com.oilresource.oil.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CursorPageResponse<T>(
    List<T> items, String currentPage, String nextPage, int size) {

  public CursorPageResponse {
    items = List.copyOf(items);
  }
}
