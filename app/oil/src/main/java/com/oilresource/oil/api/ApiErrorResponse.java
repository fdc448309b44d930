/*
 * どこで: Oil API
 * 何を: API エラー応答の共通 DTO
 * なぜ: 認証失敗から業務エラーまでを同じ {code, message} 形式で返すため
 */
package com.oilresource.oil.api;

public record ApiErrorResponse(String code, String message) {}
