/*
 * どこで: Oil API サービス層
 * 何を: 不正なページ指定やカーソルなど、入力起因の失敗を表現する
 * なぜ: 400 応答へ変換するため
 */
package com.oilresource.oil.service;

public class InvalidOilRequestException extends RuntimeException {

  public InvalidOilRequestException(String message) {
    super(message);
  }

  public InvalidOilRequestException(String message, Throwable cause) {
    super(message, cause);
  }
}
