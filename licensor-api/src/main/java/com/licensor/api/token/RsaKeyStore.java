package com.licensor.api.token;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.converter.RsaKeyConverters;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.NoSuchAlgorithmException;
import java.security.interfaces.RSAPrivateKey;
import java.security.interfaces.RSAPublicKey;
import java.util.Base64;
import java.util.Set;

/**
 * RSA key pair for license tokens, kept as two PEM files.
 *
 * - private half: PKCS#8 "PRIVATE KEY", owner read/write only
 * - public half: X.509 "PUBLIC KEY", world readable
 *
 * If either file is missing a fresh 2048-bit pair replaces both.
 */
public final class RsaKeyStore {

  private static final Logger log = LoggerFactory.getLogger(RsaKeyStore.class);

  static final int KEY_SIZE = 2048;

  private static final Set<PosixFilePermission> PRIVATE_PERMS = PosixFilePermissions.fromString("rw-------");
  private static final Set<PosixFilePermission> PUBLIC_PERMS = PosixFilePermissions.fromString("rw-r--r--");

  private final Path privateKeyPath;
  private final Path publicKeyPath;

  public RsaKeyStore(Path privateKeyPath, Path publicKeyPath) {
    this.privateKeyPath = privateKeyPath;
    this.publicKeyPath = publicKeyPath;
  }

  /**
   * @throws IllegalStateException when the keys can be neither read nor written
   */
  public LoadedKeys loadOrCreate() {
    try {
      if (Files.exists(privateKeyPath) && Files.exists(publicKeyPath)) {
        LoadedKeys keys = read();
        log.info("Loaded license signing keys from {}", privateKeyPath.toAbsolutePath().getParent());
        return keys;
      }
      LoadedKeys keys = generate();
      log.info("Generated new license signing key pair at {}", privateKeyPath.toAbsolutePath().getParent());
      return keys;
    } catch (IOException | UncheckedIOException | IllegalArgumentException e) {
      throw new IllegalStateException("Cannot load or create license signing keys at " + privateKeyPath, e);
    }
  }

  private LoadedKeys read() throws IOException {
    RSAPrivateKey priv;
    RSAPublicKey pub;
    try (InputStream in = Files.newInputStream(privateKeyPath)) {
      priv = RsaKeyConverters.pkcs8().convert(in);
    }
    try (InputStream in = Files.newInputStream(publicKeyPath)) {
      pub = RsaKeyConverters.x509().convert(in);
    }
    return new LoadedKeys(pub, priv);
  }

  private LoadedKeys generate() throws IOException {
    KeyPair pair;
    try {
      KeyPairGenerator gen = KeyPairGenerator.getInstance("RSA");
      gen.initialize(KEY_SIZE);
      pair = gen.generateKeyPair();
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("RSA not available", e);
    }

    createParent(privateKeyPath);
    createParent(publicKeyPath);

    writePem(privateKeyPath, "PRIVATE KEY", pair.getPrivate().getEncoded(), PRIVATE_PERMS);
    writePem(publicKeyPath, "PUBLIC KEY", pair.getPublic().getEncoded(), PUBLIC_PERMS);

    return new LoadedKeys((RSAPublicKey) pair.getPublic(), (RSAPrivateKey) pair.getPrivate());
  }

  private static void createParent(Path file) throws IOException {
    Path parent = file.toAbsolutePath().getParent();
    if (parent != null) Files.createDirectories(parent);
  }

  private static void writePem(Path file, String type, byte[] der, Set<PosixFilePermission> perms) throws IOException {
    String body = Base64.getMimeEncoder(64, "\n".getBytes(StandardCharsets.US_ASCII)).encodeToString(der);
    String pem = "-----BEGIN " + type + "-----\n" + body + "\n-----END " + type + "-----\n";

    Files.deleteIfExists(file);
    if (posix()) {
      // permissions are set before any key bytes are written
      Files.createFile(file, PosixFilePermissions.asFileAttribute(perms));
      Files.writeString(file, pem, StandardCharsets.US_ASCII);
      Files.setPosixFilePermissions(file, perms);
    } else {
      Files.writeString(file, pem, StandardCharsets.US_ASCII);
    }
  }

  private static boolean posix() {
    return FileSystems.getDefault().supportedFileAttributeViews().contains("posix");
  }

  public record LoadedKeys(RSAPublicKey publicKey, RSAPrivateKey privateKey) {}
}
