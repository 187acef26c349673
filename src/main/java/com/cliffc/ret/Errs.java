package com.cliffc.ret;

import com.cliffc.ret.util.Ary;
import com.cliffc.ret.util.SB;

import java.util.Arrays;
import java.util.concurrent.ConcurrentLinkedQueue;

/** Compilation-unit wide diagnostics sink.  Per-function passes append
 *  concurrently; readers get the messages sorted by source location, never in
 *  completion order. */
public class Errs {
  private final ConcurrentLinkedQueue<ErrMsg> _msgs = new ConcurrentLinkedQueue<>();

  public ErrMsg add( ErrMsg err ) { _msgs.add(err); return err; }

  // Sorted snapshot of all messages
  public Ary<ErrMsg> sorted() {
    Ary<ErrMsg> errs = new Ary<>(ErrMsg.class);
    for( ErrMsg err : _msgs ) errs.push(err);
    Arrays.sort(errs._es,0,errs._len);
    return errs;
  }
  public Ary<ErrMsg> errors  () { return filter(false); }
  public Ary<ErrMsg> warnings() { return filter(true ); }
  private Ary<ErrMsg> filter( boolean warn ) {
    Ary<ErrMsg> errs = new Ary<>(ErrMsg.class);
    for( ErrMsg err : sorted() )
      if( err.warn()==warn )
        errs.push(err);
    return errs;
  }
  public boolean has_errors() { return _msgs.stream().anyMatch(e -> !e.warn()); }
  public int size() { return _msgs.size(); }

  @Override public String toString() {
    SB sb = new SB();
    for( ErrMsg err : sorted() ) sb.p(err.toString()).nl();
    return sb.toString();
  }
}
