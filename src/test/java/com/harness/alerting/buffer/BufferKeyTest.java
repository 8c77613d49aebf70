package com.harness.alerting.buffer;

import java.util.Set;
import java.util.UUID;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BufferKeyTest {

  @Test
  void encodingIsIndependentOfGroupOrder() {
    UUID owner = UUID.fromString("00000000-0000-0000-0000-000000000001");
    UUID a = UUID.fromString("00000000-0000-0000-0000-00000000000a");
    UUID b = UUID.fromString("00000000-0000-0000-0000-00000000000b");

    String encoded = new BufferKey(owner, 42L, Set.of(b, a)).encode();

    assertThat(encoded).isEqualTo(owner + ":42:" + a + "," + b);
    assertThat(BufferKey.decode(encoded)).isEqualTo(new BufferKey(owner, 42L, Set.of(a, b)));
  }

  @Test
  void malformedKeysAreRejected() {
    assertThatThrownBy(() -> BufferKey.decode("not-a-key")).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> BufferKey.decode(UUID.randomUUID() + ":abc:" + UUID.randomUUID()))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> BufferKey.decode(UUID.randomUUID() + ":1:nope"))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new BufferKey(UUID.randomUUID(), 1L, Set.of()))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
