package com.cliffc.ret.ast;

import com.cliffc.ret.util.Ary;
import com.cliffc.ret.util.SB;

// "case subject { pat [if guard] -> body, ... }".  Kid 0 is the subject; arm i
// has its guard at kid 2i+1 (null when absent) and its body at kid 2i+2.
// An arm whose guard is False falls through to the next arm.
public class Case extends AST {
  public final Ary<Pat> _pats;
  public Case( AST subject, Ary<AST> guards, Ary<AST> arms, Ary<Pat> pats ) {
    super(kids(subject,guards,arms));
    assert arms._len==pats._len && guards._len==pats._len;
    _pats = pats;
  }
  private Case( Ary<AST> kids, Ary<Pat> pats ) { super(kids); _pats = pats; }
  private static Ary<AST> kids( AST subject, Ary<AST> guards, Ary<AST> arms ) {
    Ary<AST> kids = new Ary<>(AST.class).push(subject);
    for( int i=0; i<arms._len; i++ )
      kids.push(guards.at(i)).push(arms.at(i));
    return kids;
  }
  public AST subject() { return _kids.at(0); }
  public int narms() { return _pats._len; }
  public AST guard( int i ) { return _kids.at(2*i+1); }
  public AST arm( int i ) { return _kids.at(2*i+2); }
  public Pat pat( int i ) { return _pats.at(i); }
  // Arm owning kid k, or -1 for the subject
  public static int arm_of( int k ) { return k==0 ? -1 : (k-1)/2; }
  public static boolean is_guard( int k ) { return (k&1)==1; }

  // Same case with arm i's pattern, guard and body replaced
  public Case with_arm( int i, Pat pat, AST guard, AST body ) {
    Ary<Pat> pats = _pats.copy();
    pats.set(i,pat);
    Ary<AST> kids = _kids.copy();
    kids.set(2*i+1,guard);
    kids.set(2*i+2,body);
    Case c = new Case(kids,pats);
    c._loc = _loc;  c._tv = _tv;  c._div = _div;  c._dead = _dead;
    return c;
  }

  @Override public SB str( SB sb ) {
    subject().str(sb.p("case ")).p(" { ");
    for( int i=0; i<narms(); i++ ) {
      pat(i).str(sb);
      if( guard(i)!=null ) guard(i).str(sb.p(" if "));
      arm(i).str(sb.p(" -> ")).p(", ");
    }
    return sb.unchar(2).p(" }");
  }
  @Override AST make( Ary<AST> kids ) { return new Case(kids,_pats); }
}
