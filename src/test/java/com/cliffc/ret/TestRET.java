package com.cliffc.ret;

import org.junit.Rule;
import org.junit.Test;
import org.junit.contrib.java.lang.system.SystemErrRule;
import org.junit.contrib.java.lang.system.SystemOutRule;

import java.nio.file.Paths;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class TestRET {
  @Rule public final SystemOutRule sysOut = new SystemOutRule().enableLog().muteForSuccessfulTests();
  @Rule public final SystemErrRule sysErr = new SystemErrRule().enableLog().muteForSuccessfulTests();

  private String out() { return sysOut.getLogWithNormalizedLineSeparator(); }

  @Test public void testRun() {
    RET.run("t.ret","fn f(x) { if x > 0 { return x }; 0 - x }",Target.RESTRICTED,"f",-3L);
    assertEquals("fn f(x) { if x > 0 { x } else { 0 - x } }\n=> 3\n",out());
  }

  @Test public void testWarning() {
    RET.run("t.ret","fn f() { return 1; 2 }",Target.NATIVE,null);
    assertEquals("fn f() { return 1; 2 }\n"+
                 "t.ret:1: warning: Unreachable code\n"+
                 "fn f() { return 1; 2 }\n"+
                 "                   ^\n",out());
  }

  // Errors suppress evaluation
  @Test public void testError() {
    RET.run("t.ret","fn f() { g() }",Target.RESTRICTED,"f");
    assertEquals("t.ret:1: Unknown ref 'g'\nfn f() { g() }\n         ^\n",out());
  }

  @Test public void testMain() throws Exception {
    String file = Paths.get(TestRET.class.getResource("/progs/callbacks.ret").toURI()).toString();
    RET.main(new String[]{"-restricted",file,"-eval","total","3"});
    assertTrue(out(),out().endsWith("\n6\n=> 16\n"));
    assertTrue(out(),out().contains("fn total(x) { with(x * 2, fn(y) { if y < 0 { 0 } else { print(int_to_string(y)); "));
  }

  @Test public void testUsage() throws Exception {
    RET.main(new String[]{"-bogus"});
    assertEquals("",out());
    assertTrue(sysErr.getLog().startsWith("Usage: RET"));
  }

  @Test public void testArg() {
    assertEquals(Boolean.TRUE,RET.arg("True"));
    assertEquals(-3L,RET.arg("-3"));
    assertEquals("abc",RET.arg("abc"));
  }
}
