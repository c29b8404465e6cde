/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.quarry.models;

import static net.hydromatic.quarry.ast.AstBuilder.ast;

import net.hydromatic.quarry.ast.Ast;
import net.hydromatic.quarry.model.Field;
import net.hydromatic.quarry.model.Function;
import net.hydromatic.quarry.model.Model;
import net.hydromatic.quarry.model.Multiplicity;
import net.hydromatic.quarry.model.Ordering;
import net.hydromatic.quarry.model.Predicate;
import net.hydromatic.quarry.model.Signature;

/**
 * Model of a ROS publish/subscribe system in which a joystick node drives a
 * wheel node over the "cmd_vel" topic, and an attacker node may join the
 * network.
 *
 * <p>Time is ordered. At each step except the last, at most one event
 * occurs: a node publishes a message to a topic, or the middleware calls
 * back a subscriber with a message published earlier. The wheel records
 * the commands it has received in its history.
 *
 * <p>The assertion {@code WheelSafe} says that every command in the wheel's
 * history comes from the joystick's behavior mapping. It holds if there is
 * no attacker, and fails if there is one, because nothing prevents the
 * attacker from advertising the topic.
 */
public class RosSecurityModel {
  /** Name of the model in {@link ModelCatalog}. */
  public static final String NAME = "ros";

  public static final String NO_ATTACKER_WHEEL_SAFE = "NoAttackerWheelSafe";
  public static final String ATTACKER_WHEEL_UNSAFE = "AttackerWheelUnsafe";
  public static final String JOYSTICK_COMMAND_REACHES_WHEEL =
      "JoystickCommandReachesWheel";

  private RosSecurityModel() {}

  /** Creates the model. */
  public static Model create() {
    final Model.Builder b = Model.builder("RosSecurity");

    final Signature time = b.sig("Time");
    final Ordering order = b.ordered(time);
    final Signature component = b.abstractSig("Component", null);
    final Signature joystick = b.oneSig("Joystick", component);
    final Signature wheel = b.oneSig("Wheel", component);
    final Signature attacker = b.sig("Attacker", component);
    final Signature topic = b.abstractSig("Topic", null);
    final Signature cmdVel = b.oneSig("CmdVel", topic);
    final Signature data = b.sig("Data");
    final Signature event = b.abstractSig("Event", null);
    final Signature publish = b.sig("Publish", event);
    final Signature callback = b.sig("Callback", event);

    final Field advertises =
        b.field(component, "advertises", Multiplicity.SET, topic);
    final Field subscribes =
        b.field(component, "subscribes", Multiplicity.SET, topic);
    final Field behavior =
        b.field(joystick, "behavior", Multiplicity.SET, data);
    final Field at = b.field(event, "at", Multiplicity.ONE, time);
    final Field topicOf = b.field(event, "topic", Multiplicity.ONE, topic);
    final Field caller =
        b.field(publish, "caller", Multiplicity.ONE, component);
    final Field callee =
        b.field(callback, "callee", Multiplicity.ONE, component);
    final Field message = b.field(event, "message", Multiplicity.ONE, data);
    final Field history =
        b.field(wheel, "history", Multiplicity.SET, data, time);

    final Ast.Variable t = ast.var("t");
    final Ast.Variable d = ast.var("d");
    final Ast.Variable p = ast.var("p");
    final Ast.Variable c = ast.var("c");
    final Ast.Expr nonLast = time.expr().difference(order.last);

    // fun wheelState[t: Time]: Data { Wheel.history.t }
    final Function wheelState =
        b.fun("wheelState", ast.join(wheel.expr(), history.expr(), t),
            ast.decl(t, time.expr()));

    // fun delivered[t: Time]: Data { (at.t & callee.Wheel).message }
    final Function delivered =
        b.fun("delivered",
            at.expr().join(t)
                .intersection(callee.expr().join(wheel.expr()))
                .join(message.expr()),
            ast.decl(t, time.expr()));

    // pred receives[d: Data, t: Time] { d in wheelState[t] }
    final Predicate receives =
        b.pred("receives", d.in(wheelState.call(t)),
            ast.decl(d, data.expr()), ast.decl(t, time.expr()));

    b.fact("topology",
        ast.and(
            joystick.expr().join(advertises.expr()).eq(cmdVel.expr()),
            joystick.expr().join(subscribes.expr()).no(),
            wheel.expr().join(subscribes.expr()).eq(cmdVel.expr()),
            wheel.expr().join(advertises.expr()).no(),
            attacker.expr().join(subscribes.expr()).no()));
    b.fact("publishPermission",
        ast.all(ast.decl(p, publish.expr()),
            p.join(topicOf.expr())
                .in(p.join(caller.expr()).join(advertises.expr()))));
    b.fact("joystickBehavior",
        ast.all(ast.decl(p, publish.expr()),
            p.join(caller.expr()).eq(joystick.expr())
                .implies(
                    p.join(message.expr())
                        .in(joystick.expr().join(behavior.expr())))));
    b.fact("callbackCausality",
        ast.all(ast.decl(c, callback.expr()),
            ast.and(
                c.join(topicOf.expr())
                    .in(c.join(callee.expr()).join(subscribes.expr())),
                ast.some(ast.decl(p, publish.expr()),
                    ast.and(
                        p.join(topicOf.expr()).eq(c.join(topicOf.expr())),
                        p.join(message.expr()).eq(c.join(message.expr())),
                        p.join(at.expr())
                            .in(order.prevs(c.join(at.expr()))))))));
    b.fact("oneEventPerStep",
        ast.all(ast.decl(t, nonLast), at.expr().join(t).lone()));
    b.fact("quietLastStep", at.expr().join(order.last).no());
    b.fact("historyStartsEmpty", wheelState.call(order.first).no());
    b.fact("historyFrame",
        ast.all(ast.decl(t, nonLast),
            wheelState.call(order.next(t))
                .eq(wheelState.call(t).union(delivered.call(t)))));

    // assert WheelSafe {
    //   all t: Time, d: Data | receives[d, t] => d in Joystick.behavior }
    b.pred("WheelSafe",
        ast.all(ast.decl(t, time.expr()), ast.decl(d, data.expr()),
            receives.call(d, t)
                .implies(d.in(joystick.expr().join(behavior.expr())))));

    // pred JoystickCommandReachesWheel {
    //   some t: Time | some (wheelState[t] & Joystick.behavior) }
    b.pred("joystickCommandReachesWheel",
        ast.some(ast.decl(t, time.expr()),
            wheelState.call(t)
                .intersection(joystick.expr().join(behavior.expr()))
                .some()));

    b.check(NO_ATTACKER_WHEEL_SAFE, "WheelSafe",
        "3 but 5 Time, 4 Event, exactly 0 Attacker");
    b.check(ATTACKER_WHEEL_UNSAFE, "WheelSafe",
        "3 but 5 Time, 4 Event, exactly 1 Attacker", 1);
    b.run(JOYSTICK_COMMAND_REACHES_WHEEL, "joystickCommandReachesWheel",
        "3 but 5 Time, 4 Event");
    return b.build();
  }
}

// End RosSecurityModel.java
