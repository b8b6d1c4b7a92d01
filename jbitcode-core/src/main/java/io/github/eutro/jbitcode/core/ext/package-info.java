/**
 * The ext API allows for associating arbitrary data with
 * instances of {@link io.github.eutro.jbitcode.core.ext.ExtContainer}.
 *
 * <pre>{@code
 * class Person extends ExtHolder { ... }
 *
 * class PersonExts {
 *   public static final Ext<String> NAME = Ext.create(String.class, "name");
 *   public static final Ext<Integer> AGE = Ext.create(Integer.class, "age");
 * }
 *
 * Person person = new Person();
 * person.attachExt(AGE, 33);
 * person.attachExt(NAME, "Jane");
 *
 * person.getExtOrThrow(AGE); // => 33
 * person.getExtOrThrow(NAME); // => "Jane"
 * }</pre>
 * <p>
 * Every IR value is an ext container. The reader uses this to hang decode-only
 * information off the graph (debug locations, the materializer of a module,
 * where a placeholder was created) without widening the IR classes.
 * <p>
 * Values {@link io.github.eutro.jbitcode.core.ext.DelegatingExtHolder delegate} to
 * their parent, so an ext attached to a module is visible from its functions,
 * their blocks and their instructions.
 * <p>
 * Specialised implementations may implement fast-paths for certain
 * {@link io.github.eutro.jbitcode.core.ext.Ext}s by storing them directly in fields.
 */
package io.github.eutro.jbitcode.core.ext;
