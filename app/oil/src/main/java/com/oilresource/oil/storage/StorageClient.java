package com.oilresource.oil.storage;

import java.util.Map;

/** アップロード先オブジェクトストレージの抽象。実装は署名付き URL の発行と削除だけを担う。 */
public interface StorageClient {

  /**
   * クライアントが直接 PUT するための署名付き URL を発行する。
   *
   * @param key 保存先キー。空なら新規に採番し、{@code uploads/} で始まらなければ前置する
   * @param metadata オブジェクトに付与するメタデータ。{@code content-type} は Content-Type として署名される
   */
  UploadUrl getUploadUrl(String key, Map<String, String> metadata);

  void deleteFile(String key);
}
