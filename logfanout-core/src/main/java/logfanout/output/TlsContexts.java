package logfanout.output;

import org.bouncycastle.asn1.pkcs.PrivateKeyInfo;
import org.bouncycastle.cert.X509CertificateHolder;
import org.bouncycastle.cert.jcajce.JcaX509CertificateConverter;
import org.bouncycastle.openssl.PEMEncryptedKeyPair;
import org.bouncycastle.openssl.PEMException;
import org.bouncycastle.openssl.PEMKeyPair;
import org.bouncycastle.openssl.PEMParser;
import org.bouncycastle.openssl.jcajce.JcaPEMKeyConverter;
import org.bouncycastle.pkcs.PKCS8EncryptedPrivateKeyInfo;
import org.bouncycastle.util.encoders.DecoderException;

import javax.net.ssl.KeyManager;
import javax.net.ssl.KeyManagerFactory;
import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManager;
import javax.net.ssl.TrustManagerFactory;
import javax.net.ssl.X509TrustManager;
import java.io.IOException;
import java.io.StringReader;
import java.security.GeneralSecurityException;
import java.security.KeyStore;
import java.security.PrivateKey;
import java.security.cert.Certificate;
import java.security.cert.X509Certificate;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds client {@link SSLContext}s from PEM material stored on a syslog target.
 *
 * <p>The CA bundle, when present, replaces the JDK trust store. PEM is read with
 * BouncyCastle; the client key may be PKCS#8, PKCS#1 or SEC1, unencrypted.
 */
final class TlsContexts {
  private static final char[] NO_PASSWORD = new char[0];
  private static final JcaPEMKeyConverter KEY_CONVERTER = new JcaPEMKeyConverter();
  private static final JcaX509CertificateConverter CERTIFICATE_CONVERTER =
      new JcaX509CertificateConverter();

  private TlsContexts() {
  }

  /**
   * @param caPem      CA certificate(s), or empty to use the JDK defaults
   * @param certPem    client certificate chain, or empty
   * @param keyPem     client private key, or empty
   * @param skipVerify accept any server certificate
   * @return an initialised TLS context
   * @throws IOException if the PEM material cannot be parsed
   */
  static SSLContext build(String caPem, String certPem, String keyPem, boolean skipVerify)
      throws IOException {
    try {
      TrustManager[] trustManagers = null;
      if (skipVerify) {
        trustManagers = new TrustManager[] {new TrustAllManager()};
      } else if (!caPem.isEmpty()) {
        List<X509Certificate> authorities;
        try {
          authorities = parseCertificates(caPem);
        } catch (IOException e) {
          throw new IOException("failed to parse CA certificate: " + e.getMessage(), e);
        }
        KeyStore trustStore = KeyStore.getInstance(KeyStore.getDefaultType());
        trustStore.load(null, null);
        int i = 0;
        for (X509Certificate cert : authorities) {
          trustStore.setCertificateEntry("ca-" + i++, cert);
        }
        if (i == 0) {
          throw new IOException("failed to parse CA certificate");
        }
        TrustManagerFactory tmf = TrustManagerFactory.getInstance(
            TrustManagerFactory.getDefaultAlgorithm());
        tmf.init(trustStore);
        trustManagers = tmf.getTrustManagers();
      }

      KeyManager[] keyManagers = null;
      if (!certPem.isEmpty() && !keyPem.isEmpty()) {
        Certificate[] chain;
        try {
          chain = parseCertificates(certPem).toArray(new Certificate[0]);
        } catch (IOException e) {
          throw new IOException("failed to load client certificate: " + e.getMessage(), e);
        }
        if (chain.length == 0) {
          throw new IOException("failed to load client certificate: no certificate in PEM");
        }
        KeyStore keyStore = KeyStore.getInstance(KeyStore.getDefaultType());
        keyStore.load(null, null);
        PrivateKey key;
        try {
          key = parsePrivateKey(keyPem);
        } catch (PEMException e) {
          throw new IOException("failed to load client key: " + e.getMessage(), e);
        }
        keyStore.setKeyEntry("client", key, NO_PASSWORD, chain);
        KeyManagerFactory kmf = KeyManagerFactory.getInstance(
            KeyManagerFactory.getDefaultAlgorithm());
        kmf.init(keyStore, NO_PASSWORD);
        keyManagers = kmf.getKeyManagers();
      }

      SSLContext context = SSLContext.getInstance("TLS");
      context.init(keyManagers, trustManagers, null);
      return context;
    } catch (GeneralSecurityException e) {
      throw new IOException("failed to build TLS config: " + e.getMessage(), e);
    }
  }

  private static List<X509Certificate> parseCertificates(String pem)
      throws IOException, GeneralSecurityException {
    List<X509Certificate> certificates = new ArrayList<>();
    try (PEMParser parser = new PEMParser(new StringReader(pem))) {
      Object pemObject;
      while ((pemObject = parser.readObject()) != null) {
        if (pemObject instanceof X509CertificateHolder) {
          certificates.add(CERTIFICATE_CONVERTER.getCertificate((X509CertificateHolder) pemObject));
        }
      }
    } catch (DecoderException e) {
      throw new PEMException("invalid base64 in PEM", e);
    }
    return certificates;
  }

  /** Accepts PKCS#8, PKCS#1 ({@code RSA PRIVATE KEY}) and SEC1 ({@code EC PRIVATE KEY}). */
  private static PrivateKey parsePrivateKey(String pem) throws IOException {
    try (PEMParser parser = new PEMParser(new StringReader(pem))) {
      Object pemObject;
      while ((pemObject = parser.readObject()) != null) {
        if (pemObject instanceof PrivateKeyInfo) {
          return KEY_CONVERTER.getPrivateKey((PrivateKeyInfo) pemObject);
        } else if (pemObject instanceof PEMKeyPair) {
          return KEY_CONVERTER.getKeyPair((PEMKeyPair) pemObject).getPrivate();
        } else if (pemObject instanceof PEMEncryptedKeyPair
            || pemObject instanceof PKCS8EncryptedPrivateKeyInfo) {
          throw new IOException("failed to load client key: encrypted keys are not supported");
        }
      }
    } catch (DecoderException e) {
      throw new PEMException("invalid base64 in PEM", e);
    }
    throw new IOException("failed to load client key: no private key in PEM");
  }

  private static final class TrustAllManager implements X509TrustManager {
    @Override
    public void checkClientTrusted(X509Certificate[] chain, String authType) {
    }

    @Override
    public void checkServerTrusted(X509Certificate[] chain, String authType) {
    }

    @Override
    public X509Certificate[] getAcceptedIssuers() {
      return new X509Certificate[0];
    }
  }
}
