/*
 * どこで: Publisher モデル
 * 何を: 資格情報を引くための識別子の組(プロバイダ ID / 内部 ID / メール)を保持する
 * なぜ: 再割り当てされない識別子から順に照合するため
 */
package com.example.publisher.model;

public record OwnerIdentity(String providerUserId, String ownerKey, String email) {

  public static OwnerIdentity ofOwner(String ownerKey) {
    return new OwnerIdentity(null, ownerKey, null);
  }

  public boolean isEmpty() {
    return isBlank(providerUserId) && isBlank(ownerKey) && isBlank(email);
  }

  public String describe() {
    if (!isBlank(providerUserId)) {
      return "providerUserId=" + providerUserId;
    }
    if (!isBlank(ownerKey)) {
      return "ownerKey=" + ownerKey;
    }
    return "email=" + email;
  }

  static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
