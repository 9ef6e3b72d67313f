/*
 * Copyright 2015 The Closure Compiler Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.google.eventracer.instrument;

import static com.google.common.truth.Truth.assertThat;

import com.google.eventracer.ast.IR;
import com.google.eventracer.ast.Node;
import com.google.eventracer.ast.Token;
import com.google.eventracer.instrument.testing.SimpleParser;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class CodePrinterTest {

  private static String print(String js) {
    return CodePrinter.compact(SimpleParser.parse(js));
  }

  private static void assertPrintSame(String js) {
    assertThat(print(js)).isEqualTo(js);
  }

  @Test
  public void testDeclarations() {
    assertPrintSame("var a=1,b;");
    assertPrintSame("let c=a;const d=\"x\";");
    assertThat(print("var a = 1 , b ;")).isEqualTo("var a=1,b;");
  }

  @Test
  public void testStatements() {
    assertPrintSame("if(a){b();}else{c();}");
    assertPrintSame("while(a){break;}");
    assertPrintSame("do{continue;}while(a);");
    assertPrintSame("for(var i=0;i<n;i++){}");
    assertPrintSame("for(;;){}");
    assertPrintSame("for(var k in o){}");
    assertPrintSame("for(x of xs){}");
    assertPrintSame("switch(a){case 1:b;break;default:c;}");
    assertPrintSame("try{a();}catch(e){throw e;}finally{b();}");
    assertPrintSame("with(o){x;}");
    assertPrintSame("outer:while(a){break outer;}");
    assertPrintSame("debugger;");
  }

  @Test
  public void testStatementBodiesArePrintedAsBlocks() {
    assertThat(print("if (a) b(); else c();")).isEqualTo("if(a){b();}else{c();}");
  }

  @Test
  public void testFunctions() {
    assertPrintSame("function f(a,b){return a+b;}");
    assertPrintSame("var g=function(){return;};");
    assertPrintSame("(function(){})();");
    assertPrintSame("(function(){}).call(this);");
  }

  @Test
  public void testObjectLiteralAtStatementStart() {
    assertPrintSame("({a:1,\"b c\":2}).a;");
    assertPrintSame("x={};");
  }

  @Test
  public void testLiterals() {
    assertPrintSame("[1,,\"two\",null,true,false,this];");
    assertPrintSame("x=/a[/]b/;");
    assertThat(print("x = 'it\\'s';")).isEqualTo("x=\"it's\";");
    assertThat(print("x = \"a\\nb\\\"\";")).isEqualTo("x=\"a\\nb\\\"\";");
    assertThat(print("x = 0x10;")).isEqualTo("x=16;");
    assertPrintSame("x=1.5;");
  }

  @Test
  public void testProperties() {
    assertPrintSame("a.b.c;");
    assertPrintSame("a[b][0];");
    assertPrintSame("a.b(c)[d]();");
    assertThat(CodePrinter.compact(IR.getprop(IR.name("a"), "not an identifier")))
        .isEqualTo("a[\"not an identifier\"]");
    assertThat(CodePrinter.compact(IR.getprop(IR.number(1), "toString")))
        .isEqualTo("(1).toString");
  }

  @Test
  public void testNew() {
    assertPrintSame("new F(a,b);");
    assertPrintSame("new a.B();");
    assertPrintSame("new (f())();");
    assertPrintSame("new (a.b().C)();");
  }

  @Test
  public void testRuntimeCall() {
    assertPrintSame("%InitializeVarGlobal(\"v\",0,1);");
    assertPrintSame("x=%GetContextN(2);");
  }

  @Test
  public void testPrecedence() {
    assertPrintSame("a+b*c;");
    assertPrintSame("(a+b)*c;");
    assertPrintSame("a-(b-c);");
    assertPrintSame("a-b-c;");
    assertPrintSame("a=b=c;");
    assertThat(print("(a,b);")).isEqualTo("a,b;");
    assertPrintSame("f((a,b));");
    assertPrintSame("a?b:c?d:e;");
    assertPrintSame("(a?b:c)?d:e;");
    assertPrintSame("a**b**c;");
    assertPrintSame("(a**b)**c;");
    assertPrintSame("!(a&&b)||c;");
    assertPrintSame("x=a in b;");
    assertPrintSame("x=a instanceof b;");
    assertPrintSame("typeof a===\"undefined\";");
    assertPrintSame("void 0;");
    assertPrintSame("delete a.b;");
  }

  @Test
  public void testUnaryOperatorsDoNotMerge() {
    Node plus = IR.binaryOp(Token.ADD, IR.name("a"), IR.unaryOp(Token.POS, IR.name("b")));
    assertThat(CodePrinter.compact(plus)).isEqualTo("a+ +b");
    Node minus = IR.binaryOp(Token.SUB, IR.name("a"), IR.unaryOp(Token.NEG, IR.number(1)));
    assertThat(CodePrinter.compact(minus)).isEqualTo("a- -1");
    assertPrintSame("a- --b;");
    assertPrintSame("+ +a;");
  }

  @Test
  public void testUpdates() {
    assertPrintSame("a++;");
    assertPrintSame("--a.b;");
    assertPrintSame("x=+a[i]-1;");
  }

  @Test
  public void testCompoundAssignments() {
    assertPrintSame("a+=1;a-=1;a*=1;a/=1;a%=1;a**=1;");
    assertPrintSame("a<<=1;a>>=1;a>>>=1;a&=1;a|=1;a^=1;");
  }

  @Test
  public void testYield() {
    assertPrintSame("function g(){yield a;yield* b;yield;}");
  }

  @Test
  public void testIdentifierValidity() {
    assertThat(CodePrinter.isValidIdentifier("$obj")).isTrue();
    assertThat(CodePrinter.isValidIdentifier("_a1")).isTrue();
    assertThat(CodePrinter.isValidIdentifier("1a")).isFalse();
    assertThat(CodePrinter.isValidIdentifier("")).isFalse();
    assertThat(CodePrinter.isValidIdentifier("a-b")).isFalse();
  }
}
