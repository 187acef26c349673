package com.cliffc.ret;

import com.cliffc.ret.exe.Eval;
import com.cliffc.ret.util.Ary;
import org.junit.Test;

import java.io.File;
import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Files;

import static org.junit.Assert.*;

/** Runs every program under resources/progs.  Header comments carry the
 *  expected outcome:
 *  <pre>
 *  // EXPECT: fn args... => value
 *  // WARNINGS: n
 *  // ERRORS: n
 *  </pre>
 *  Every EXPECT is checked against both the source and the lowered code. */
public class TestProgs {

  @Test public void testProgs() throws IOException, URISyntaxException {
    File dir = new File(TestProgs.class.getResource("/progs").toURI());
    File[] files = dir.listFiles((d,name) -> name.endsWith(".ret"));
    assertNotNull(files);
    assertTrue(files.length >= 5);
    for( File file : files )
      test(file.getName(),new String(Files.readAllBytes(file.toPath())));
  }

  private static void test( String name, String src ) {
    Unit low = Unit.parse(name,src).compile(Target.RESTRICTED);
    Unit nat = Unit.parse(name,src).compile(Target.NATIVE);
    assertEquals(name,nat._errs.toString(),low._errs.toString());
    int expects=0;
    for( String line : src.split("\n") ) {
      if( line.startsWith("// WARNINGS:") )
        assertEquals(name,Integer.parseInt(line.substring(12).trim()),low._errs.warnings()._len);
      if( line.startsWith("// ERRORS:") )
        assertEquals(name+"\n"+low._errs,Integer.parseInt(line.substring(10).trim()),low._errs.errors()._len);
      if( line.startsWith("// EXPECT:") ) {
        String[] parts = line.substring(10).split("=>");
        String[] call = parts[0].trim().split(" +");
        Ary<Object> args = new Ary<>(Object.class);
        for( int i=1; i<call.length; i++ ) args.push(RET.arg(call[i]));
        String expect = parts[1].trim();
        Eval e0 = nat.eval_source(), e1 = low.eval();
        assertEquals(name+" "+parts[0],expect,Eval.pstr(e0.call(call[0],args.asAry())));
        assertEquals(name+" "+parts[0],expect,Eval.pstr(e1.call(call[0],args.asAry())));
        assertEquals(String.join(",",e0._log),String.join(",",e1._log));
        assertEquals(0,e1._unwinds);
        expects++;
      }
    }
    assertTrue(name,expects > 0);
  }
}
