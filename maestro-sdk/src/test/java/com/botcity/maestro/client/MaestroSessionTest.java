package com.botcity.maestro.client;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.testng.annotations.Test;

@Test
public class MaestroSessionTest {

  public void when_server_has_trailing_slash_should_strip_it() {
    MaestroSession withSlash = new MaestroSession("http://x/", "login", "key");
    MaestroSession withoutSlash = new MaestroSession("http://x", "login", "key");

    assertEquals("http://x", withSlash.getServer());
    assertEquals(withoutSlash.getServer(), withSlash.getServer());
  }

  public void when_server_has_two_trailing_slashes_should_strip_only_one() {
    assertEquals("http://x/", MaestroSession.normalizeServer("http://x//"));
  }

  public void when_server_is_null_should_stay_null() {
    assertNull(MaestroSession.normalizeServer(null));
    assertNull(new MaestroSession().getServer());
  }

  public void when_setting_server_should_normalize() {
    MaestroSession session = new MaestroSession();
    session.setServer("https://portal.example.com/");
    assertEquals("https://portal.example.com", session.getServer());
  }

  public void when_no_token_require_token_should_throw() {
    MaestroSession session = new MaestroSession("http://x", "login", "key");
    try {
      session.requireToken();
      fail("Expected PreconditionException");
    } catch (PreconditionException e) {
      assertTrue(e.getMessage().contains("login"));
    }
  }

  public void when_token_set_should_be_returned_and_valid() {
    MaestroSession session = new MaestroSession("http://x", "login", "key");
    session.setAccessToken("T");

    assertTrue(session.isValid());
    assertEquals("T", session.requireToken());
  }

  public void when_logoff_should_clear_token() {
    MaestroSession session = new MaestroSession("http://x", "login", "key");
    session.setAccessToken("T");

    session.logoff();

    assertFalse(session.isValid());
    assertNull(session.getAccessToken());
    try {
      session.requireToken();
      fail("Expected PreconditionException");
    } catch (PreconditionException e) {
      assertEquals(MaestroSession.LOGIN_REQUIRED_MESSAGE, e.getMessage());
    }
  }

  public void when_logoff_without_token_should_not_throw() {
    MaestroSession session = new MaestroSession();
    session.logoff();
    assertFalse(session.isValid());
  }

  public void when_preparing_login_without_server_should_name_server() {
    MaestroSession session = new MaestroSession(null, "login", "key");
    try {
      session.prepareLogin(null, null, null);
      fail("Expected ConfigurationException");
    } catch (ConfigurationException e) {
      assertEquals("Server is required.", e.getMessage());
    }
  }

  public void when_preparing_login_without_login_should_name_login() {
    MaestroSession session = new MaestroSession("http://x", "", "key");
    try {
      session.prepareLogin(null, null, null);
      fail("Expected ConfigurationException");
    } catch (ConfigurationException e) {
      assertEquals("Login is required.", e.getMessage());
    }
  }

  public void when_preparing_login_without_key_should_name_key() {
    MaestroSession session = new MaestroSession("http://x", "login", null);
    try {
      session.prepareLogin(null, null, "");
      fail("Expected ConfigurationException");
    } catch (ConfigurationException e) {
      assertEquals("Key is required.", e.getMessage());
    }
  }

  public void when_preparing_login_with_overrides_should_replace_values() {
    MaestroSession session = new MaestroSession("http://old", "old-login", "old-key");

    session.prepareLogin("http://new/", "new-login", null);

    assertEquals("http://new", session.getServer());
    assertEquals("new-login", session.getLogin());
    assertEquals("old-key", session.getKey());
  }

  public void when_to_string_should_not_expose_secrets() {
    MaestroSession session = new MaestroSession("http://x", "login", "secret-key");
    session.setAccessToken("secret-token");

    String text = session.toString();
    assertFalse(text.contains("secret-key"));
    assertFalse(text.contains("secret-token"));
  }
}
