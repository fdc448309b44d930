package com.oilresource.oil.storage;

// リトライを使い切ってもストレージ操作が成功しなかったことを表す。
public class StorageOperationException extends RuntimeException {

  public StorageOperationException(String message, Throwable cause) {
    super(message, cause);
  }
}
