package com.codeheadsystems.tessera.server.credential;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.tessera.server.random.RandomProvider;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class InMemoryCredentialStoreTest {

  // Minimal cost keeps the suite fast.
  private static final PasswordHashParameters CHEAP = new PasswordHashParameters(8, 1, 1);

  private InMemoryCredentialStore store;

  @BeforeEach
  void setUp() {
    store = new InMemoryCredentialStore(new Argon2PasswordHasher(CHEAP), new RandomProvider());
    store.register("admin", "publish");
  }

  @Test
  void verify_correctPassword_returnsLogin() {
    assertThat(store.verify("admin", "publish")).contains("admin");
  }

  @Test
  void verify_wrongPassword_returnsEmpty() {
    assertThat(store.verify("admin", "bad_password")).isEmpty();
  }

  @Test
  void verify_unknownLogin_returnsEmpty() {
    assertThat(store.verify("nobody", "publish")).isEmpty();
  }

  @Test
  void verify_nulls_returnEmpty() {
    assertThat(store.verify(null, "publish")).isEmpty();
    assertThat(store.verify("admin", null)).isEmpty();
  }

  @Test
  void register_replacesPassword() {
    store.register("admin", "changed");

    assertThat(store.verify("admin", "publish")).isEmpty();
    assertThat(store.verify("admin", "changed")).contains("admin");
  }

  @Test
  void delete_removesUser() {
    store.delete("admin");

    assertThat(store.verify("admin", "publish")).isEmpty();
  }

  @Test
  void register_missingFields_rejected() {
    assertThatThrownBy(() -> store.register(" ", "pw")).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> store.register("user", "")).isInstanceOf(IllegalArgumentException.class);
  }
}
